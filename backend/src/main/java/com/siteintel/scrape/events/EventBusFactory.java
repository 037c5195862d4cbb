package com.siteintel.scrape.events;

import com.siteintel.config.ScraperProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

@Component
public class EventBusFactory {
    private final ScraperProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService sweepScheduler;

    public EventBusFactory(
        ScraperProperties properties,
        Clock clock,
        @Qualifier("eventSweepScheduler") ScheduledExecutorService sweepScheduler
    ) {
        this.properties = properties;
        this.clock = clock;
        this.sweepScheduler = sweepScheduler;
    }

    public ProgressEventBus create(String correlationId, EventSubscriber subscriber) {
        ScraperProperties.Events events = properties.getEvents();
        return new ProgressEventBus(
            correlationId,
            clock,
            new DedupCache(clock, Duration.ofSeconds(events.getDedupTtlSeconds())),
            new DedupCache(clock, Duration.ofMillis(events.getNotificationWindowMs())),
            subscriber,
            sweepScheduler,
            Duration.ofSeconds(events.getSweepIntervalSeconds())
        );
    }
}
