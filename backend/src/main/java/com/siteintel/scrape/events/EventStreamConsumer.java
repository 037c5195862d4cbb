package com.siteintel.scrape.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Optional;

/**
 * Reads a text event stream and republishes each recognised event on a local bus, so retried or
 * overlapping server events are suppressed before reaching handlers.
 */
@Component
public class EventStreamConsumer {
    private static final Logger log = LoggerFactory.getLogger(EventStreamConsumer.class);

    private final ProgressEventCodec codec;

    public EventStreamConsumer(ProgressEventCodec codec) {
        this.codec = codec;
    }

    /**
     * Consumes until end of stream and returns the number of events delivered to the bus subscriber.
     */
    public int consume(BufferedReader reader, ProgressEventBus bus) throws IOException {
        int delivered = 0;
        StringBuilder data = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                delivered += dispatch(data, bus);
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
            }
        }
        delivered += dispatch(data, bus);
        return delivered;
    }

    private int dispatch(StringBuilder data, ProgressEventBus bus) {
        if (data.length() == 0) {
            return 0;
        }
        String payload = data.toString();
        data.setLength(0);
        Optional<ProgressEvent> event = codec.decode(payload);
        if (event.isEmpty()) {
            log.debug("ignoring unrecognised stream event length={}", payload.length());
            return 0;
        }
        return bus.publish(event.get()) ? 1 : 0;
    }
}
