package com.siteintel.scrape.fetch;

public enum ScrapeErrorKind {
    NETWORK,
    PARSE,
    ENHANCEMENT_FAILURE,
    STREAM_WRITE,
    PERSISTENCE,
    UNEXPECTED
}
