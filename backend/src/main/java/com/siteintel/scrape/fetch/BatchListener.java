package com.siteintel.scrape.fetch;

@FunctionalInterface
public interface BatchListener {

    void onBatchComplete(BatchProgress progress);

    static BatchListener noop() {
        return progress -> {
        };
    }

    record BatchProgress(
        int batchNumber,
        int totalBatches,
        int batchSize,
        int completed,
        int succeeded,
        int failed,
        int total
    ) {
    }
}
