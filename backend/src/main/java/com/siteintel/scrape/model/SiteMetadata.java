package com.siteintel.scrape.model;

public record SiteMetadata(
    String technology,
    String siteType
) {
    public static SiteMetadata unknown() {
        return new SiteMetadata(null, null);
    }

    public boolean hasTechnology() {
        return technology != null && !technology.isBlank();
    }
}
