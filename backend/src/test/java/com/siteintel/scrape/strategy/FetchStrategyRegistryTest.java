package com.siteintel.scrape.strategy;

import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchStrategyRegistryTest {

    @Test
    void exactMatchWins() {
        FetchStrategy staticStrategy = new NamedStrategy(StrategyKind.STATIC);
        FetchStrategy spaStrategy = new NamedStrategy(StrategyKind.SPA);
        FetchStrategyRegistry registry = new FetchStrategyRegistry(List.of(staticStrategy, spaStrategy));

        assertThat(registry.resolve(StrategyKind.STATIC)).isSameAs(staticStrategy);
        assertThat(registry.resolve(StrategyKind.SPA)).isSameAs(spaStrategy);
    }

    @Test
    void missingKindFallsBackToNearestPreferringHeavier() {
        FetchStrategy staticStrategy = new NamedStrategy(StrategyKind.STATIC);
        FetchStrategy spaStrategy = new NamedStrategy(StrategyKind.SPA);
        FetchStrategyRegistry registry = new FetchStrategyRegistry(List.of(staticStrategy, spaStrategy));

        assertThat(registry.isRegistered(StrategyKind.DYNAMIC)).isFalse();
        assertThat(registry.resolve(StrategyKind.DYNAMIC)).isSameAs(spaStrategy);
    }

    @Test
    void escalationStepsUpAndSaturatesAtSpa() {
        FetchStrategy staticStrategy = new NamedStrategy(StrategyKind.STATIC);
        FetchStrategyRegistry registry = new FetchStrategyRegistry(List.of(staticStrategy));

        assertThat(registry.escalationTarget(StrategyKind.STATIC)).isEqualTo(StrategyKind.DYNAMIC);
        assertThat(registry.escalationTarget(StrategyKind.SPA)).isEqualTo(StrategyKind.SPA);
        assertThat(registry.escalationTarget(null)).isEqualTo(StrategyKind.DYNAMIC);
        assertThat(registry.resolveEscalation(StrategyKind.STATIC)).isSameAs(staticStrategy);
    }

    @Test
    void registryNeedsAtLeastOneStrategy() {
        assertThatThrownBy(() -> new FetchStrategyRegistry(List.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    private record NamedStrategy(StrategyKind kind) implements FetchStrategy {
        @Override
        public boolean stateful() {
            return false;
        }

        @Override
        public PageRecord fetch(String url, FetchContext context, SiteMetadata siteMetadata) {
            throw new UnsupportedOperationException();
        }
    }
}
