package com.siteintel.scrape.model;

public record SitemapUrlEntry(
    String url,
    String lastmod,
    String changefreq,
    Double priority
) {
}
