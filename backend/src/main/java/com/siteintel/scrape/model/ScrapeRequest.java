package com.siteintel.scrape.model;

import com.siteintel.scrape.events.Phase;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Input to one pipeline run. {@code urls}, when non-empty, replaces discovery.
 */
public record ScrapeRequest(
    String domain,
    List<String> urls,
    Integer maxPages,
    Integer timeoutSeconds,
    ScrapeMode mode,
    Set<Phase> skipPhases,
    String sessionId,
    String correlationId
) {
    public ScrapeRequest {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        domain = domain.trim();
        urls = urls == null ? List.of() : List.copyOf(urls);
        skipPhases = skipPhases == null || skipPhases.isEmpty() ? Set.of() : Set.copyOf(skipPhases);
    }

    public static ScrapeRequest forDomain(String domain) {
        return new ScrapeRequest(domain, null, null, null, null, null, null, null);
    }

    public boolean hasExplicitUrls() {
        return !urls.isEmpty();
    }

    /**
     * Requested skips plus the ones implied by the mode and by an explicit URL list.
     */
    public Set<Phase> effectiveSkipPhases() {
        Set<Phase> skipped = EnumSet.noneOf(Phase.class);
        skipped.addAll(skipPhases);
        if (mode == ScrapeMode.INITIAL) {
            skipped.add(Phase.VALIDATION);
            skipped.add(Phase.ENHANCEMENT);
        }
        if (hasExplicitUrls()) {
            skipped.add(Phase.DISCOVERY);
        }
        skipped.remove(Phase.COMPLETE);
        return skipped;
    }
}
