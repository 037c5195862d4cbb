package com.siteintel.scrape.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one discovery pass. {@code stepCounts} and {@code stepErrors} are keyed by step name
 * (sitemap, homepage, pattern, blog, validation).
 */
public record DiscoveryResult(
    String domain,
    List<DiscoveredUrl> urls,
    int sitemapsFetched,
    Map<String, Integer> stepCounts,
    Map<String, String> stepErrors,
    int droppedUnreachable,
    long durationMs
) {
}
