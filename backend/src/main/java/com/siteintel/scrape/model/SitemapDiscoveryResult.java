package com.siteintel.scrape.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<SitemapFetchRecord> fetchedSitemaps,
    List<SitemapUrlEntry> discoveredUrls,
    Map<String, Integer> errors
) {
    public static SitemapDiscoveryResult empty() {
        return new SitemapDiscoveryResult(List.of(), List.of(), Map.of());
    }
}
