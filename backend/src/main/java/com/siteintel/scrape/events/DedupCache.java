package com.siteintel.scrape.events;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keys seen within the last {@code ttl}. Expired entries count as absent even before a sweep removes them.
 */
public class DedupCache {
    private final Clock clock;
    private final Duration ttl;
    private final Map<DedupKey, Instant> entries = new ConcurrentHashMap<>();

    public DedupCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Records {@code key} and returns true when it was not seen within the TTL; returns false for a duplicate.
     */
    public boolean insert(DedupKey key) {
        Instant now = clock.instant();
        boolean[] inserted = new boolean[1];
        entries.compute(key, (ignored, seenAt) -> {
            if (seenAt == null || isExpired(seenAt, now)) {
                inserted[0] = true;
                return now;
            }
            return seenAt;
        });
        return inserted[0];
    }

    public boolean contains(DedupKey key) {
        Instant seenAt = entries.get(key);
        return seenAt != null && !isExpired(seenAt, clock.instant());
    }

    /**
     * Removes expired entries and returns how many were purged.
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(Instant seenAt, Instant now) {
        return !seenAt.plus(ttl).isAfter(now);
    }
}
