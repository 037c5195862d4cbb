package com.siteintel.scrape.model;

public record DatasetMetadata(
    int pagesScraped,
    int pagesAttempted,
    int pagesFailed,
    int pagesEnhanced,
    double averageValidationScore,
    String scraperUsed,
    long durationMs
) {
    public static DatasetMetadata empty() {
        return new DatasetMetadata(0, 0, 0, 0, 0.0, null, 0L);
    }
}
