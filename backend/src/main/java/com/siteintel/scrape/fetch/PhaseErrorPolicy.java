package com.siteintel.scrape.fetch;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.events.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catch-log-continue rules for one phase. {@code maxToleratedFailures < 0} means unlimited.
 */
public record PhaseErrorPolicy(
    Phase phase,
    int maxToleratedFailures,
    FailureMode failureMode
) {
    private static final Logger log = LoggerFactory.getLogger(PhaseErrorPolicy.class);

    public enum FailureMode {
        /** The failed slot holds null. */
        NULL_PLACEHOLDER,
        /** The failed slot keeps the record it had before the phase. */
        KEEP_ORIGINAL
    }

    public static PhaseErrorPolicy rapidScrape(ScraperProperties properties) {
        return new PhaseErrorPolicy(
            Phase.RAPID_SCRAPE,
            properties.getFetch().getMaxToleratedFailures(),
            FailureMode.NULL_PLACEHOLDER
        );
    }

    public static PhaseErrorPolicy enhancement(ScraperProperties properties) {
        return new PhaseErrorPolicy(
            Phase.ENHANCEMENT,
            properties.getEnhancement().getMaxToleratedFailures(),
            FailureMode.KEEP_ORIGINAL
        );
    }

    public Tracker tracker() {
        return new Tracker(this);
    }

    /**
     * Per-run failure counter for a policy.
     */
    public static final class Tracker {
        private final PhaseErrorPolicy policy;
        private final AtomicInteger failures = new AtomicInteger();

        private Tracker(PhaseErrorPolicy policy) {
            this.policy = policy;
        }

        public void recordFailure(String url, ScrapeErrorKind kind, String message) {
            int count = failures.incrementAndGet();
            log.warn(
                "page failed phase={} url={} kind={} failures={} error={}",
                policy.phase().wireName(),
                url,
                kind,
                count,
                message
            );
        }

        public int failures() {
            return failures.get();
        }

        public boolean exhausted() {
            return policy.maxToleratedFailures() >= 0 && failures.get() > policy.maxToleratedFailures();
        }

        public PhaseErrorPolicy policy() {
            return policy;
        }
    }
}
