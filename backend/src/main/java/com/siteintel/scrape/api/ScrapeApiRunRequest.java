package com.siteintel.scrape.api;

import com.siteintel.scrape.events.Phase;
import com.siteintel.scrape.model.ScrapeMode;
import com.siteintel.scrape.model.ScrapeRequest;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record ScrapeApiRunRequest(
    String domain,
    List<String> urls,
    Integer maxPages,
    Integer timeoutSeconds,
    String mode,
    List<String> skipPhases,
    String sessionId,
    String correlationId
) {
    ScrapeRequest toScrapeRequest(String resolvedCorrelationId) {
        Set<Phase> skip = EnumSet.noneOf(Phase.class);
        if (skipPhases != null) {
            for (String phase : skipPhases) {
                if (phase != null && !phase.isBlank()) {
                    skip.add(Phase.fromWireName(phase));
                }
            }
        }
        return new ScrapeRequest(
            domain,
            urls,
            maxPages,
            timeoutSeconds,
            ScrapeMode.fromValue(mode),
            skip,
            sessionId,
            resolvedCorrelationId
        );
    }
}
