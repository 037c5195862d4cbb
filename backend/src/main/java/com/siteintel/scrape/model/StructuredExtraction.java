package com.siteintel.scrape.model;

public record StructuredExtraction(PageEntities entities) implements PageExtraction {
}
