package com.siteintel.scrape.enhance;

import com.siteintel.config.ScraperProperties;
import com.siteintel.config.Sleeper;
import com.siteintel.scrape.PageFixtures;
import com.siteintel.scrape.fetch.AbortSignal;
import com.siteintel.scrape.fetch.BatchFetchExecutor;
import com.siteintel.scrape.fetch.PageFetchException;
import com.siteintel.scrape.fetch.ScrapeErrorKind;
import com.siteintel.scrape.model.EnhancementCandidate;
import com.siteintel.scrape.model.EnhancementOutcome;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import com.siteintel.scrape.strategy.FetchContext;
import com.siteintel.scrape.strategy.FetchStrategy;
import com.siteintel.scrape.strategy.FetchStrategyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancementEscalatorTest {
    private static final FetchContext CONTEXT = new FetchContext("corr", "session", Duration.ofSeconds(5));

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void replacesFlaggedPagesAtTheirOriginalPosition() {
        List<PageRecord> pages = List.of(
            PageFixtures.page("https://acme.test/", "Home", "home text"),
            PageFixtures.page("https://acme.test/app", "App", "Loading..."),
            PageFixtures.page("https://acme.test/about", "About", "about text"),
            PageFixtures.page("https://acme.test/shop", null, "x")
        );
        List<EnhancementCandidate> candidates = List.of(
            new EnhancementCandidate(1, pages.get(1), "javascript placeholder content"),
            new EnhancementCandidate(3, pages.get(3), "content too short")
        );
        EnhancementEscalator escalator = escalator(new RenderingStrategy(StrategyKind.DYNAMIC, Set.of()));

        EnhancementOutcome outcome = escalator.enhance(
            pages, candidates, StrategyKind.STATIC, CONTEXT, SiteMetadata.unknown(), AbortSignal.none(), null);

        assertThat(outcome.pages()).hasSize(4);
        assertThat(outcome.pages().get(0)).isSameAs(pages.get(0));
        assertThat(outcome.pages().get(1).strategy()).isEqualTo(StrategyKind.DYNAMIC);
        assertThat(outcome.pages().get(1).content()).isEqualTo("rendered https://acme.test/app");
        assertThat(outcome.pages().get(2)).isSameAs(pages.get(2));
        assertThat(outcome.pages().get(3).strategy()).isEqualTo(StrategyKind.DYNAMIC);
        assertThat(outcome.attempted()).isEqualTo(2);
        assertThat(outcome.enhanced()).isEqualTo(2);
        assertThat(outcome.failed()).isZero();
        assertThat(pages.get(1).content()).isEqualTo("Loading...");
    }

    @Test
    void failedRefetchKeepsTheOriginalRecord() {
        List<PageRecord> pages = List.of(
            PageFixtures.page("https://acme.test/a", "A", "thin"),
            PageFixtures.page("https://acme.test/b", "B", "thin")
        );
        List<EnhancementCandidate> candidates = List.of(
            new EnhancementCandidate(0, pages.get(0), "content too short"),
            new EnhancementCandidate(1, pages.get(1), "content too short")
        );
        EnhancementEscalator escalator = escalator(
            new RenderingStrategy(StrategyKind.DYNAMIC, Set.of("https://acme.test/b")));

        EnhancementOutcome outcome = escalator.enhance(
            pages, candidates, StrategyKind.STATIC, CONTEXT, SiteMetadata.unknown(), AbortSignal.none(), null);

        assertThat(outcome.pages().get(0).strategy()).isEqualTo(StrategyKind.DYNAMIC);
        assertThat(outcome.pages().get(1)).isSameAs(pages.get(1));
        assertThat(outcome.enhanced()).isEqualTo(1);
        assertThat(outcome.failed()).isEqualTo(1);
    }

    @Test
    void escalatesFromDynamicToTheNearestHeavierRegisteredStrategy() {
        List<PageRecord> pages = List.of(PageFixtures.fetchedWith("https://acme.test/", StrategyKind.DYNAMIC, "x"));
        EnhancementEscalator escalator = escalator(
            new RenderingStrategy(StrategyKind.STATIC, Set.of()),
            new RenderingStrategy(StrategyKind.SPA, Set.of()));

        EnhancementOutcome outcome = escalator.enhance(
            pages,
            List.of(new EnhancementCandidate(0, pages.get(0), "content too short")),
            StrategyKind.DYNAMIC,
            CONTEXT,
            SiteMetadata.unknown(),
            AbortSignal.none(),
            null
        );

        assertThat(outcome.pages().get(0).strategy()).isEqualTo(StrategyKind.SPA);
    }

    @Test
    void batchesCandidatesWithTheEnhancementSettings() {
        List<PageRecord> pages = List.of(
            PageFixtures.page("https://acme.test/1", "1", "x"),
            PageFixtures.page("https://acme.test/2", "2", "x"),
            PageFixtures.page("https://acme.test/3", "3", "x")
        );
        List<EnhancementCandidate> candidates = List.of(
            new EnhancementCandidate(0, pages.get(0), "content too short"),
            new EnhancementCandidate(1, pages.get(1), "content too short"),
            new EnhancementCandidate(2, pages.get(2), "content too short")
        );
        EnhancementEscalator escalator = escalator(new RenderingStrategy(StrategyKind.DYNAMIC, Set.of()));

        EnhancementOutcome outcome = escalator.enhance(
            pages, candidates, StrategyKind.STATIC, CONTEXT, SiteMetadata.unknown(), AbortSignal.none(), null);

        assertThat(outcome.enhanced()).isEqualTo(3);
        assertThat(sleeps).containsExactly(500L);
    }

    @Test
    void noCandidatesReturnsPagesUntouched() {
        List<PageRecord> pages = List.of(PageFixtures.page("https://acme.test/", "Home", "home text"));
        RenderingStrategy strategy = new RenderingStrategy(StrategyKind.DYNAMIC, Set.of());

        EnhancementOutcome outcome = escalator(strategy).enhance(
            pages, List.of(), StrategyKind.STATIC, CONTEXT, SiteMetadata.unknown(), AbortSignal.none(), null);

        assertThat(outcome.pages()).containsExactlyElementsOf(pages);
        assertThat(outcome.attempted()).isZero();
        assertThat(strategy.fetched).isEmpty();
    }

    private EnhancementEscalator escalator(FetchStrategy... strategies) {
        Sleeper sleeper = sleeps::add;
        return new EnhancementEscalator(
            new BatchFetchExecutor(executor, sleeper),
            new FetchStrategyRegistry(List.of(strategies)),
            new ScraperProperties()
        );
    }

    private static final class RenderingStrategy implements FetchStrategy {
        private final StrategyKind kind;
        private final Set<String> failing;
        private final List<String> fetched = new CopyOnWriteArrayList<>();

        private RenderingStrategy(StrategyKind kind, Set<String> failing) {
            this.kind = kind;
            this.failing = failing;
        }

        @Override
        public StrategyKind kind() {
            return kind;
        }

        @Override
        public boolean stateful() {
            return false;
        }

        @Override
        public PageRecord fetch(String url, FetchContext context, SiteMetadata siteMetadata) {
            fetched.add(url);
            if (failing.contains(url)) {
                throw new PageFetchException(ScrapeErrorKind.NETWORK, url, "render timed out");
            }
            return PageFixtures.fetchedWith(url, kind, "rendered " + url);
        }
    }
}
