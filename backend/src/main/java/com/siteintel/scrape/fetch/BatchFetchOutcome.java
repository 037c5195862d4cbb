package com.siteintel.scrape.fetch;

import com.siteintel.scrape.model.PageRecord;

import java.util.List;
import java.util.Set;

/**
 * {@code records} is aligned with the input URL list. {@code fetchedSlots} holds the indexes that received a
 * fresh record in this phase; any other slot is null or, under {@code KEEP_ORIGINAL}, the record it had before.
 */
public record BatchFetchOutcome(
    List<PageRecord> records,
    Set<Integer> fetchedSlots,
    List<Integer> batchSizes,
    int succeeded,
    int failed,
    int notAttempted,
    boolean aborted
) {
    public int attempted() {
        return succeeded + failed;
    }

    public boolean fetched(int index) {
        return fetchedSlots.contains(index);
    }
}
