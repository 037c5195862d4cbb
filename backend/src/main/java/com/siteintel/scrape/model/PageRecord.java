package com.siteintel.scrape.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * One fetched page. {@code html} is the raw markup when the strategy kept it, otherwise null.
 */
public record PageRecord(
    String url,
    String title,
    String content,
    String html,
    StrategyKind strategy,
    PageExtraction extraction,
    List<String> errors,
    Instant fetchedAt
) {
    public PageRecord {
        extraction = extraction == null ? new RawExtraction() : extraction;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @JsonIgnore
    public PageEntities entities() {
        if (extraction instanceof StructuredExtraction structured) {
            return structured.entities();
        }
        return PageEntities.empty();
    }

    @JsonIgnore
    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
