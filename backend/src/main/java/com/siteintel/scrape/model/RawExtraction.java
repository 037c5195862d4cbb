package com.siteintel.scrape.model;

public record RawExtraction() implements PageExtraction {
}
