package com.siteintel.scrape.model;

public record DiscoveredUrl(
    String url,
    String title,
    double priority,
    DiscoverySource source,
    String lastmod,
    String changefreq
) {
    public DiscoveredUrl {
        priority = Math.max(0.0, Math.min(1.0, priority));
    }

    public static DiscoveredUrl of(String url, String title, double priority, DiscoverySource source) {
        return new DiscoveredUrl(url, title, priority, source, null, null);
    }
}
