package com.siteintel.scrape.model;

import java.util.List;

public record RunSummary(
    List<String> phasesRun,
    int totalAttempted,
    int pagesSucceeded,
    int pagesFailed,
    double validationScore,
    int enhancementCount,
    long durationMs,
    boolean partial
) {
}
