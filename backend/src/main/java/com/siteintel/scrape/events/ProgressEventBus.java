package com.siteintel.scrape.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delivers progress events for one run to a single subscriber.
 *
 * <p>An event whose (type, source, timestamp) key was seen within the TTL is dropped. Status notifications
 * are also dropped when the same message and level were sent within the notification window. Only the
 * first terminal event is delivered. A subscriber that throws is cut off; publishing keeps working so the
 * run itself is unaffected.
 */
public class ProgressEventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressEventBus.class);

    private final String correlationId;
    private final Clock clock;
    private final DedupCache eventCache;
    private final DedupCache notificationCache;
    private final EventSubscriber subscriber;
    private final ScheduledFuture<?> sweepTask;
    private boolean terminalDelivered;
    private boolean subscriberFailed;
    private boolean closed;
    private int delivered;

    public ProgressEventBus(
        String correlationId,
        Clock clock,
        DedupCache eventCache,
        DedupCache notificationCache,
        EventSubscriber subscriber,
        ScheduledExecutorService sweepScheduler,
        Duration sweepInterval
    ) {
        this.correlationId = correlationId;
        this.clock = clock;
        this.eventCache = eventCache;
        this.notificationCache = notificationCache;
        this.subscriber = subscriber;
        if (sweepScheduler != null && sweepInterval != null) {
            long intervalMs = Math.max(1L, sweepInterval.toMillis());
            this.sweepTask = sweepScheduler.scheduleAtFixedRate(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweepTask = null;
        }
    }

    public synchronized boolean publish(ProgressEvent event) {
        if (closed) {
            log.debug("event dropped after close correlationId={} type={}", correlationId, event.type());
            return false;
        }
        if (terminalDelivered && event.isTerminal()) {
            log.debug("extra terminal event dropped correlationId={} type={} source={}",
                correlationId, event.type(), event.sourceId());
            return false;
        }
        if (!eventCache.insert(DedupKey.forEvent(event))) {
            log.debug("duplicate event dropped correlationId={} type={} source={}",
                correlationId, event.type(), event.sourceId());
            return false;
        }
        if (event.type() == EventKind.STATUS && event.payload().get("message") instanceof String message) {
            String level = String.valueOf(event.payload().getOrDefault("level", "info"));
            if (!notificationCache.insert(DedupKey.forNotification(message, level))) {
                log.debug("duplicate notification dropped correlationId={} message={}", correlationId, message);
                return false;
            }
        }
        if (event.isTerminal()) {
            terminalDelivered = true;
        }
        deliver(event);
        return true;
    }

    public boolean progress(Phase phase, String sourceId, Map<String, Object> payload) {
        return publish(event(EventKind.PROGRESS, phase, EventPriority.NORMAL, sourceId, payload));
    }

    public boolean data(Phase phase, String sourceId, Map<String, Object> payload) {
        return publish(event(EventKind.DATA, phase, EventPriority.LOW, sourceId, payload));
    }

    public boolean notify(Phase phase, String sourceId, String message, String level) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("level", level);
        return publish(event(EventKind.STATUS, phase, EventPriority.NORMAL, sourceId, payload));
    }

    public boolean complete(Map<String, Object> payload) {
        return publish(event(EventKind.COMPLETE, Phase.COMPLETE, EventPriority.HIGH, "run:complete", payload));
    }

    public boolean error(Phase phase, String sourceId, String message, boolean fatal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("fatal", fatal);
        EventPriority priority = fatal ? EventPriority.FATAL : EventPriority.HIGH;
        return publish(event(EventKind.ERROR, phase, priority, sourceId, payload));
    }

    public int sweep() {
        int purged = eventCache.sweep() + notificationCache.sweep();
        if (purged > 0) {
            log.debug("dedup sweep correlationId={} purged={}", correlationId, purged);
        }
        return purged;
    }

    public synchronized boolean isTerminalDelivered() {
        return terminalDelivered;
    }

    public synchronized int deliveredCount() {
        return delivered;
    }

    public String correlationId() {
        return correlationId;
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
    }

    private ProgressEvent event(EventKind type, Phase phase, EventPriority priority, String sourceId, Map<String, Object> payload) {
        return new ProgressEvent(type, phase, priority, correlationId, clock.instant(), sourceId, payload);
    }

    private void deliver(ProgressEvent event) {
        if (subscriberFailed) {
            return;
        }
        try {
            subscriber.onEvent(event);
            delivered++;
        } catch (RuntimeException e) {
            subscriberFailed = true;
            log.warn("event subscriber failed, further events are not delivered correlationId={}", correlationId, e);
        }
    }
}
