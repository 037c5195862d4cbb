package com.siteintel.scrape.model;

import java.util.List;

public record ValidationResult(
    PageRecord page,
    double score,
    List<String> reasons,
    boolean flagged
) {
    public ValidationResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public String reasonText() {
        return reasons.isEmpty() ? "below quality threshold" : String.join("; ", reasons);
    }
}
