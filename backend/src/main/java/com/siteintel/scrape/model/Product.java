package com.siteintel.scrape.model;

public record Product(
    String name,
    String description,
    String price,
    String url
) {
}
