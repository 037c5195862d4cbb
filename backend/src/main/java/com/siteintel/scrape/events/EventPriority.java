package com.siteintel.scrape.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventPriority {
    LOW,
    NORMAL,
    HIGH,
    FATAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventPriority fromWireName(String value) {
        if (value != null) {
            for (EventPriority priority : values()) {
                if (priority.wireName().equalsIgnoreCase(value.trim())) {
                    return priority;
                }
            }
        }
        return NORMAL;
    }
}
