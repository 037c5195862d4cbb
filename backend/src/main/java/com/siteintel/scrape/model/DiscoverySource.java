package com.siteintel.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DiscoverySource {
    SITEMAP,
    HOMEPAGE,
    PATTERN,
    BLOG,
    CRAWL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
