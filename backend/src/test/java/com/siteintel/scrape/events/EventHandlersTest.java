package com.siteintel.scrape.events;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventHandlersTest {

    @Test
    void dispatchesByKindAndIgnoresUnhandledKinds() {
        List<String> calls = new ArrayList<>();
        EventHandlers handlers = EventHandlers.builder()
            .on(EventKind.DATA, event -> calls.add("data:" + event.sourceId()))
            .build();

        handlers.onEvent(event(EventKind.DATA, "page-1"));
        handlers.onEvent(event(EventKind.PROGRESS, "batch-1"));

        assertThat(calls).containsExactly("data:page-1");
    }

    @Test
    void rejectsSecondHandlerForTheSameKind() {
        EventHandlers.Builder builder = EventHandlers.builder().on(EventKind.ERROR, event -> { });

        assertThatThrownBy(() -> builder.on(EventKind.ERROR, event -> { }))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ProgressEvent event(EventKind kind, String sourceId) {
        return new ProgressEvent(kind, Phase.RAPID_SCRAPE, null, "run", Instant.EPOCH, sourceId, Map.of());
    }
}
