package com.siteintel.scrape.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EventKind {
    PROGRESS,
    DATA,
    STATUS,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Empty for types this client does not know; such events are ignored, never treated as errors.
     */
    public static Optional<EventKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (EventKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
