package com.siteintel.scrape.strategy;

import com.siteintel.scrape.model.StrategyKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class FetchStrategyRegistry {
    private static final Logger log = LoggerFactory.getLogger(FetchStrategyRegistry.class);

    private final Map<StrategyKind, FetchStrategy> strategies = new EnumMap<>(StrategyKind.class);

    public FetchStrategyRegistry(List<FetchStrategy> registered) {
        for (FetchStrategy strategy : registered) {
            FetchStrategy previous = strategies.putIfAbsent(strategy.kind(), strategy);
            if (previous != null) {
                log.warn("ignoring duplicate fetch strategy kind={} class={}", strategy.kind(), strategy.getClass().getName());
            }
        }
        if (strategies.isEmpty()) {
            throw new IllegalStateException("No fetch strategy registered");
        }
    }

    /**
     * Returns the strategy registered for {@code kind}, or the nearest registered one. At equal distance the
     * heavier strategy is preferred.
     */
    public FetchStrategy resolve(StrategyKind kind) {
        FetchStrategy exact = strategies.get(kind);
        if (exact != null) {
            return exact;
        }
        StrategyKind[] kinds = StrategyKind.values();
        for (int distance = 1; distance < kinds.length; distance++) {
            int heavier = kind.ordinal() + distance;
            if (heavier < kinds.length && strategies.containsKey(kinds[heavier])) {
                return logFallback(kind, strategies.get(kinds[heavier]));
            }
            int lighter = kind.ordinal() - distance;
            if (lighter >= 0 && strategies.containsKey(kinds[lighter])) {
                return logFallback(kind, strategies.get(kinds[lighter]));
            }
        }
        throw new IllegalStateException("No fetch strategy available for " + kind);
    }

    public StrategyKind escalationTarget(StrategyKind current) {
        return current == null ? StrategyKind.DYNAMIC : current.heavier();
    }

    public FetchStrategy resolveEscalation(StrategyKind current) {
        return resolve(escalationTarget(current));
    }

    public boolean isRegistered(StrategyKind kind) {
        return strategies.containsKey(kind);
    }

    private FetchStrategy logFallback(StrategyKind requested, FetchStrategy fallback) {
        log.info("fetch strategy {} not registered, using {}", requested, fallback.kind());
        return fallback;
    }
}
