package com.siteintel.scrape.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a fetch strategy managed to pull out of a page: either structured entities or raw text only.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StructuredExtraction.class, name = "structured"),
    @JsonSubTypes.Type(value = RawExtraction.class, name = "raw")
})
public sealed interface PageExtraction permits StructuredExtraction, RawExtraction {

    static PageExtraction of(PageEntities entities) {
        if (entities == null || entities.isEmpty()) {
            return new RawExtraction();
        }
        return new StructuredExtraction(entities);
    }
}
