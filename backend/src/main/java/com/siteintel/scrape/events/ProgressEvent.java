package com.siteintel.scrape.events;

import java.time.Instant;
import java.util.Map;

/**
 * One notification on the progress stream. {@code sourceId} names what produced the event and, with the
 * type and timestamp, identifies duplicates.
 */
public record ProgressEvent(
    EventKind type,
    Phase phase,
    EventPriority priority,
    String correlationId,
    Instant timestamp,
    String sourceId,
    Map<String, Object> payload
) {
    public ProgressEvent {
        priority = priority == null ? EventPriority.NORMAL : priority;
        payload = payload == null ? Map.of() : payload;
    }

    public boolean isTerminal() {
        return type == EventKind.COMPLETE || (type == EventKind.ERROR && priority == EventPriority.FATAL);
    }
}
