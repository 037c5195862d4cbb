package com.siteintel.scrape.model;

public record TeamMember(
    String name,
    String role,
    String imageUrl
) {
}
