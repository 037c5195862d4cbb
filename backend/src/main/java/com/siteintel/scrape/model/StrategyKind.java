package com.siteintel.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fetch strategies ordered from lightest to heaviest.
 */
public enum StrategyKind {
    STATIC,
    DYNAMIC,
    SPA;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public StrategyKind heavier() {
        return this == SPA ? SPA : values()[ordinal() + 1];
    }
}
