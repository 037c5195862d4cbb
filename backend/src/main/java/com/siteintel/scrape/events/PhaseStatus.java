package com.siteintel.scrape.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PhaseStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE,
    SKIPPED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == SKIPPED || this == FAILED;
    }
}
