package com.siteintel.scrape.model;

public record SocialLink(
    String platform,
    String url
) {
}
