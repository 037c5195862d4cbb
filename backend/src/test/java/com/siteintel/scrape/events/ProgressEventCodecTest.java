package com.siteintel.scrape.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressEventCodecTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProgressEventCodec codec = new ProgressEventCodec(objectMapper);

    @Test
    void encodesWireFieldsWithLowerCaseNames() throws Exception {
        ProgressEvent event = new ProgressEvent(
            EventKind.PROGRESS,
            Phase.RAPID_SCRAPE,
            EventPriority.NORMAL,
            "run-7",
            Instant.parse("2026-03-01T10:00:00Z"),
            "rapid-scrape:batch-2",
            Map.of("completed", 10)
        );

        var json = objectMapper.readTree(codec.encode(event));

        assertThat(json.path("type").asText()).isEqualTo("progress");
        assertThat(json.path("phase").asText()).isEqualTo("rapid-scrape");
        assertThat(json.path("priority").asText()).isEqualTo("normal");
        assertThat(json.path("timestamp").asText()).isEqualTo("2026-03-01T10:00:00Z");
        assertThat(json.path("payload").path("completed").asInt()).isEqualTo(10);
    }

    @Test
    void decodesEpochMillisTimestampsAndDefaultsPriority() {
        Optional<ProgressEvent> event = codec.decode(
            "{\"type\":\"STATUS\",\"phase\":\"validation\",\"timestamp\":1772359200000,"
                + "\"sourceId\":\"validation:note\",\"payload\":{\"message\":\"ok\",\"level\":\"info\"}}");

        assertThat(event).hasValueSatisfying(decoded -> {
            assertThat(decoded.type()).isEqualTo(EventKind.STATUS);
            assertThat(decoded.phase()).isEqualTo(Phase.VALIDATION);
            assertThat(decoded.priority()).isEqualTo(EventPriority.NORMAL);
            assertThat(decoded.timestamp()).isEqualTo(Instant.ofEpochMilli(1772359200000L));
            assertThat(decoded.payload()).containsEntry("message", "ok");
        });
    }

    @Test
    void unknownTypesAndMalformedJsonAreIgnored() {
        assertThat(codec.decode("{\"type\":\"heartbeat\"}")).isEmpty();
        assertThat(codec.decode("{not json")).isEmpty();
        assertThat(codec.decode("[1,2]")).isEmpty();
        assertThat(codec.decode("  ")).isEmpty();
    }

    @Test
    void unknownPhaseStillDecodesTheEvent() {
        Optional<ProgressEvent> event = codec.decode("{\"type\":\"data\",\"phase\":\"warmup\",\"payload\":{}}");

        assertThat(event).hasValueSatisfying(decoded -> {
            assertThat(decoded.type()).isEqualTo(EventKind.DATA);
            assertThat(decoded.phase()).isNull();
        });
    }
}
