package com.siteintel.scrape.model;

import java.time.Instant;

public record SitemapFetchRecord(
    String sitemapUrl,
    Instant fetchedAt,
    int urlCount
) {
}
