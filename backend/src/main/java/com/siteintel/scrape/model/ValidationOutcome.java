package com.siteintel.scrape.model;

import java.util.List;

public record ValidationOutcome(
    List<PageRecord> accepted,
    List<EnhancementCandidate> needsEnhancement,
    List<ValidationResult> results,
    double averageScore
) {
}
