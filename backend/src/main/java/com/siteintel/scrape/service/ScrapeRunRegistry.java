package com.siteintel.scrape.service;

import com.siteintel.scrape.fetch.AbortSignal;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live runs by correlation id, so an abort request can reach the run it targets.
 */
@Component
public class ScrapeRunRegistry {
    private final Map<String, AbortSignal> activeRuns = new ConcurrentHashMap<>();

    public void register(String correlationId, AbortSignal signal) {
        if (activeRuns.putIfAbsent(correlationId, signal) != null) {
            throw new ActiveScrapeRunException("A run with correlationId " + correlationId + " is already active");
        }
    }

    public boolean abort(String correlationId) {
        AbortSignal signal = activeRuns.get(correlationId);
        if (signal == null) {
            return false;
        }
        signal.abort();
        return true;
    }

    public boolean isActive(String correlationId) {
        return activeRuns.containsKey(correlationId);
    }

    public void remove(String correlationId) {
        activeRuns.remove(correlationId);
    }
}
