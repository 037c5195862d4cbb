package com.siteintel.scrape.model;

/**
 * A page flagged by validation, with its position in the ordered page list.
 */
public record EnhancementCandidate(
    int index,
    PageRecord page,
    String reason
) {
}
