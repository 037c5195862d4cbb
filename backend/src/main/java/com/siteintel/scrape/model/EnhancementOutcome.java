package com.siteintel.scrape.model;

import java.util.List;

public record EnhancementOutcome(
    List<PageRecord> pages,
    int attempted,
    int enhanced,
    int failed
) {
}
