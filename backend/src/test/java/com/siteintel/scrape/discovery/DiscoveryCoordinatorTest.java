package com.siteintel.scrape.discovery;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.MutableClock;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoveryResult;
import com.siteintel.scrape.model.DiscoverySource;
import com.siteintel.scrape.model.SitemapDiscoveryResult;
import com.siteintel.scrape.model.SitemapFetchRecord;
import com.siteintel.scrape.model.SitemapUrlEntry;
import com.siteintel.scrape.robots.RobotsRules;
import com.siteintel.scrape.robots.RobotsTxtService;
import com.siteintel.scrape.sitemap.SitemapService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryCoordinatorTest {
    private static final String HOME = "https://example.com/";

    @Mock
    private RobotsTxtService robotsTxtService;
    @Mock
    private SitemapService sitemapService;
    @Mock
    private HomepageLinkCrawler homepageLinkCrawler;
    @Mock
    private PatternPathProber patternPathProber;
    @Mock
    private BlogContentCrawler blogContentCrawler;
    @Mock
    private UrlReachabilityValidator reachabilityValidator;

    private ExecutorService executor;
    private ScraperProperties properties;
    private MutableClock clock;
    private DiscoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ScraperProperties();
        properties.getDiscovery().setValidateUrls(false);
        coordinator = new DiscoveryCoordinator(
            properties,
            robotsTxtService,
            sitemapService,
            homepageLinkCrawler,
            patternPathProber,
            blogContentCrawler,
            reachabilityValidator,
            executor,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void mergesSitemapAndFooterLinksWithoutDuplicates() {
        stubSitemap("https://example.com/", "https://example.com/about", "https://example.com/services");
        when(homepageLinkCrawler.crawl(HOME)).thenReturn(List.of(
            DiscoveredUrl.of(HOME, "Example", 1.0, DiscoverySource.HOMEPAGE),
            DiscoveredUrl.of("https://example.com/about", "About", 0.8, DiscoverySource.HOMEPAGE),
            DiscoveredUrl.of("https://example.com/privacy", "Privacy", 0.55, DiscoverySource.HOMEPAGE),
            DiscoveredUrl.of("https://example.com/terms", "Terms", 0.55, DiscoverySource.HOMEPAGE)
        ));
        when(blogContentCrawler.crawl(anyList(), eq("example.com"), anyInt())).thenReturn(List.of());

        DiscoveryResult result = coordinator.discover("example.com");

        assertThat(result.urls()).extracting(DiscoveredUrl::url).containsExactly(
            "https://example.com/",
            "https://example.com/about",
            "https://example.com/services",
            "https://example.com/privacy",
            "https://example.com/terms"
        );
        assertThat(result.urls().get(1).source()).isEqualTo(DiscoverySource.SITEMAP);
        assertThat(result.sitemapsFetched()).isEqualTo(1);
        assertThat(result.stepErrors()).isEmpty();
        verify(patternPathProber, never()).probe(HOME);
    }

    @Test
    void failingHomepageStepDoesNotStopOtherSteps() {
        stubSitemap("https://example.com/", "https://example.com/pricing");
        when(homepageLinkCrawler.crawl(HOME)).thenThrow(new IllegalStateException("homepage fetch failed status=503"));
        when(blogContentCrawler.crawl(anyList(), eq("example.com"), anyInt())).thenReturn(List.of());

        DiscoveryResult result = coordinator.discover("example.com");

        assertThat(result.urls()).extracting(DiscoveredUrl::url)
            .containsExactly("https://example.com/", "https://example.com/pricing");
        assertThat(result.stepErrors()).containsKey(DiscoveryCoordinator.STEP_HOMEPAGE);
    }

    @Test
    void unreachableUrlsAreDroppedBeforeCapping() {
        properties.getDiscovery().setValidateUrls(true);
        stubSitemap("https://example.com/", "https://example.com/about", "https://example.com/gone");
        when(homepageLinkCrawler.crawl(HOME)).thenReturn(List.of());
        when(blogContentCrawler.crawl(anyList(), eq("example.com"), anyInt())).thenReturn(List.of());
        when(reachabilityValidator.retainReachable(anyList())).thenAnswer(invocation -> {
            List<DiscoveredUrl> candidates = invocation.getArgument(0);
            return candidates.stream().filter(url -> !url.url().endsWith("/gone")).toList();
        });

        DiscoveryResult result = coordinator.discover("example.com", 1);

        assertThat(result.droppedUnreachable()).isEqualTo(1);
        assertThat(result.urls()).extracting(DiscoveredUrl::url).containsExactly("https://example.com/");
    }

    @Test
    void blogArticlesJoinTheResult() {
        stubSitemap("https://example.com/", "https://example.com/blog");
        when(homepageLinkCrawler.crawl(HOME)).thenReturn(List.of());
        when(blogContentCrawler.crawl(anyList(), eq("example.com"), anyInt())).thenReturn(List.of(
            DiscoveredUrl.of("https://example.com/blog/launch-post", "Launch Post", 0.6, DiscoverySource.BLOG)
        ));

        DiscoveryResult result = coordinator.discover("https://example.com");

        assertThat(result.urls()).extracting(DiscoveredUrl::url).contains("https://example.com/blog/launch-post");
        assertThat(result.stepCounts()).containsEntry(DiscoveryCoordinator.STEP_BLOG, 1);
    }

    @Test
    void durationIsMeasuredOnTheInjectedClock() {
        stubSitemap("https://example.com/");
        when(homepageLinkCrawler.crawl(HOME)).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(1_500));
            return List.of();
        });
        when(blogContentCrawler.crawl(anyList(), eq("example.com"), anyInt())).thenReturn(List.of());

        DiscoveryResult result = coordinator.discover("example.com");

        assertThat(result.durationMs()).isEqualTo(1_500L);
    }

    @Test
    void mergeKeepsHigherPriorityAndFirstOnTie() {
        Map<String, DiscoveredUrl> merged = new LinkedHashMap<>();
        DiscoveryCoordinator.mergeInto(merged, List.of(
            DiscoveredUrl.of("https://example.com/team", "Team", 0.5, DiscoverySource.SITEMAP)
        ));
        DiscoveryCoordinator.mergeInto(merged, List.of(
            DiscoveredUrl.of("https://example.com/team/", "Our Team", 0.8, DiscoverySource.HOMEPAGE),
            DiscoveredUrl.of("https://example.com/team", "Team again", 0.8, DiscoverySource.CRAWL)
        ));

        DiscoveredUrl team = merged.get("https://example.com/team");
        assertThat(merged).hasSize(1);
        assertThat(team.title()).isEqualTo("Our Team");
        assertThat(team.source()).isEqualTo(DiscoverySource.HOMEPAGE);
        assertThat(team.url()).isEqualTo("https://example.com/team");
    }

    private void stubSitemap(String... urls) {
        when(robotsTxtService.getRules("https://example.com")).thenReturn(RobotsRules.allowAll());
        List<SitemapUrlEntry> entries = Arrays.stream(urls)
            .map(url -> new SitemapUrlEntry(url, null, null, null))
            .toList();
        when(sitemapService.discover(anyList(), anyInt(), anyInt(), anyInt())).thenReturn(new SitemapDiscoveryResult(
            List.of(new SitemapFetchRecord("https://example.com/sitemap.xml", Instant.now(), urls.length)),
            entries,
            Map.of()
        ));
    }
}
