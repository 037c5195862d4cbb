package com.siteintel.scrape.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScrapeMode {
    INITIAL,
    DYNAMIC,
    INCREMENTAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScrapeMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ScrapeMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scrape mode: " + value);
    }
}
