package com.siteintel.scrape.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON form of a progress event: {@code {type, phase, priority, correlationId, timestamp, sourceId, payload}}.
 */
@Component
public class ProgressEventCodec {
    private static final Logger log = LoggerFactory.getLogger(ProgressEventCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProgressEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProgressEvent event) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", event.type().wireName());
        wire.put("phase", event.phase() == null ? null : event.phase().wireName());
        wire.put("priority", event.priority().wireName());
        wire.put("correlationId", event.correlationId());
        wire.put("timestamp", event.timestamp() == null ? null : event.timestamp().toString());
        wire.put("sourceId", event.sourceId());
        wire.put("payload", event.payload());
        try {
            return objectMapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode progress event " + event.type(), e);
        }
    }

    /**
     * Empty for malformed JSON and for event types this client does not know.
     */
    public Optional<ProgressEvent> decode(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        Optional<EventKind> kind = EventKind.fromWireName(root.path("type").asText(null));
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        Phase phase = null;
        String phaseName = root.path("phase").asText(null);
        if (phaseName != null) {
            try {
                phase = Phase.fromWireName(phaseName);
            } catch (IllegalArgumentException e) {
                log.debug("unknown phase on stream event phase={}", phaseName);
            }
        }
        Map<String, Object> payload = Map.of();
        JsonNode payloadNode = root.get("payload");
        if (payloadNode != null && payloadNode.isObject()) {
            payload = objectMapper.convertValue(payloadNode, PAYLOAD_TYPE);
        }
        return Optional.of(new ProgressEvent(
            kind.get(),
            phase,
            EventPriority.fromWireName(root.path("priority").asText(null)),
            root.path("correlationId").asText(null),
            parseTimestamp(root.get("timestamp")),
            root.path("sourceId").asText(null),
            payload
        ));
    }

    private Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
