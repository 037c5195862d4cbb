package com.siteintel.scrape.fetch;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for one run: tripped explicitly or by passing the run deadline.
 */
public class AbortSignal {
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final Clock clock;
    private final Instant deadline;

    public AbortSignal(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static AbortSignal none() {
        return new AbortSignal(Clock.systemUTC(), null);
    }

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get() || isPastDeadline();
    }

    public boolean isPastDeadline() {
        return deadline != null && clock.instant().isAfter(deadline);
    }

    public String reason() {
        if (aborted.get()) {
            return "aborted";
        }
        return isPastDeadline() ? "deadline_exceeded" : null;
    }
}
