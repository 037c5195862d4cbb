package com.siteintel.scrape.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Dispatch table from event kind to handler. Kinds without a handler are ignored.
 */
public final class EventHandlers implements EventSubscriber {
    private static final Logger log = LoggerFactory.getLogger(EventHandlers.class);

    private final Map<EventKind, Consumer<ProgressEvent>> table;

    private EventHandlers(Map<EventKind, Consumer<ProgressEvent>> table) {
        this.table = table;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void onEvent(ProgressEvent event) {
        Consumer<ProgressEvent> handler = table.get(event.type());
        if (handler == null) {
            log.debug("no handler for event type={}", event.type());
            return;
        }
        handler.accept(event);
    }

    public static final class Builder {
        private final Map<EventKind, Consumer<ProgressEvent>> table = new EnumMap<>(EventKind.class);

        private Builder() {
        }

        public Builder on(EventKind kind, Consumer<ProgressEvent> handler) {
            if (table.putIfAbsent(kind, handler) != null) {
                throw new IllegalArgumentException("Handler already registered for " + kind);
            }
            return this;
        }

        public EventHandlers build() {
            return new EventHandlers(new EnumMap<>(table));
        }
    }
}
