package com.siteintel.scrape.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stages in execution order.
 */
public enum Phase {
    DISCOVERY("discovery"),
    RAPID_SCRAPE("rapid-scrape"),
    VALIDATION("validation"),
    ENHANCEMENT("enhancement"),
    COMPLETE("complete");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Phase fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String candidate = value.trim();
        for (Phase phase : values()) {
            if (phase.wireName.equalsIgnoreCase(candidate) || phase.name().equalsIgnoreCase(candidate)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }
}
