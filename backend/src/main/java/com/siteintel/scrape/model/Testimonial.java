package com.siteintel.scrape.model;

public record Testimonial(
    String author,
    String quote,
    Double rating
) {
}
