package com.siteintel.scrape.events;

import com.siteintel.scrape.fetch.ScrapeErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes bus events to a server-sent event stream and completes it after the terminal event.
 * A write to an already completed emitter is benign; any other write failure closes the stream only.
 */
public class SseEventStreamWriter implements EventSubscriber {
    private static final Logger log = LoggerFactory.getLogger(SseEventStreamWriter.class);

    private final SseEmitter emitter;
    private final ProgressEventCodec codec;
    private volatile boolean closed;

    public SseEventStreamWriter(SseEmitter emitter, ProgressEventCodec codec) {
        this.emitter = emitter;
        this.codec = codec;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        if (closed) {
            return;
        }
        try {
            emitter.send(SseEmitter.event().data(codec.encode(event)));
            if (event.isTerminal()) {
                closed = true;
                emitter.complete();
            }
        } catch (IllegalStateException e) {
            closed = true;
            log.debug("stream already closed correlationId={} type={}", event.correlationId(), event.type());
        } catch (IOException e) {
            closed = true;
            log.warn("stream write failed correlationId={} type={} kind={}",
                event.correlationId(), event.type(), ScrapeErrorKind.STREAM_WRITE, e);
            emitter.completeWithError(e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        closed = true;
    }
}
