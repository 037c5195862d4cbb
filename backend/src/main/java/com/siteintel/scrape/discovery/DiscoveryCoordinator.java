package com.siteintel.scrape.discovery;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoveryResult;
import com.siteintel.scrape.model.DiscoverySource;
import com.siteintel.scrape.model.SitemapDiscoveryResult;
import com.siteintel.scrape.model.SitemapUrlEntry;
import com.siteintel.scrape.robots.RobotsTxtService;
import com.siteintel.scrape.sitemap.SitemapService;
import com.siteintel.scrape.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Finds candidate pages for a domain. Every step runs in isolation: a failing step is logged and contributes
 * nothing, the others still run. Results are merged by normalized URL, checked for reachability, sorted by
 * priority and capped.
 */
@Service
public class DiscoveryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryCoordinator.class);
    static final String STEP_SITEMAP = "sitemap";
    static final String STEP_HOMEPAGE = "homepage";
    static final String STEP_PATTERN = "pattern";
    static final String STEP_BLOG = "blog";
    static final String STEP_VALIDATION = "validation";

    private final ScraperProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final HomepageLinkCrawler homepageLinkCrawler;
    private final PatternPathProber patternPathProber;
    private final BlogContentCrawler blogContentCrawler;
    private final UrlReachabilityValidator reachabilityValidator;
    private final ExecutorService discoveryExecutor;
    private final Clock clock;

    public DiscoveryCoordinator(
        ScraperProperties properties,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        HomepageLinkCrawler homepageLinkCrawler,
        PatternPathProber patternPathProber,
        BlogContentCrawler blogContentCrawler,
        UrlReachabilityValidator reachabilityValidator,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.homepageLinkCrawler = homepageLinkCrawler;
        this.patternPathProber = patternPathProber;
        this.blogContentCrawler = blogContentCrawler;
        this.reachabilityValidator = reachabilityValidator;
        this.discoveryExecutor = discoveryExecutor;
        this.clock = clock;
    }

    public DiscoveryResult discover(String domain) {
        return discover(domain, properties.getDiscovery().getMaxPages());
    }

    public DiscoveryResult discover(String domain, int maxPages) {
        Instant startedAt = clock.instant();
        String homepageUrl = UrlNormalizer.homepageUrl(domain);
        String siteHost = UrlNormalizer.host(homepageUrl);
        int cap = Math.max(1, maxPages);

        Map<String, Integer> stepCounts = new LinkedHashMap<>();
        Map<String, String> stepErrors = new LinkedHashMap<>();
        AtomicInteger sitemapsFetched = new AtomicInteger();

        CompletableFuture<List<DiscoveredUrl>> sitemapStep = CompletableFuture.supplyAsync(
            () -> runStep(STEP_SITEMAP, stepErrors, () -> sitemapUrls(homepageUrl, siteHost, sitemapsFetched)),
            discoveryExecutor
        );
        CompletableFuture<List<DiscoveredUrl>> homepageStep = CompletableFuture.supplyAsync(
            () -> runStep(STEP_HOMEPAGE, stepErrors, () -> homepageLinkCrawler.crawl(homepageUrl)),
            discoveryExecutor
        );
        List<DiscoveredUrl> fromSitemap = sitemapStep.join();
        List<DiscoveredUrl> fromHomepage = homepageStep.join();
        stepCounts.put(STEP_SITEMAP, fromSitemap.size());
        stepCounts.put(STEP_HOMEPAGE, fromHomepage.size());

        List<DiscoveredUrl> fromPattern = List.of();
        if (properties.getDiscovery().isPatternDiscoveryEnabled()) {
            fromPattern = runStep(STEP_PATTERN, stepErrors, () -> patternPathProber.probe(homepageUrl));
            stepCounts.put(STEP_PATTERN, fromPattern.size());
        }

        Map<String, DiscoveredUrl> merged = new LinkedHashMap<>();
        mergeInto(merged, fromSitemap);
        mergeInto(merged, fromHomepage);
        mergeInto(merged, fromPattern);

        List<DiscoveredUrl> hubCandidates = new ArrayList<>(merged.values());
        List<DiscoveredUrl> fromBlog = runStep(
            STEP_BLOG,
            stepErrors,
            () -> blogContentCrawler.crawl(hubCandidates, siteHost, properties.getDiscovery().getMaxBlogPages())
        );
        stepCounts.put(STEP_BLOG, fromBlog.size());
        mergeInto(merged, fromBlog);

        List<DiscoveredUrl> ordered = new ArrayList<>(merged.values());
        ordered.sort(Comparator.comparingDouble(DiscoveredUrl::priority).reversed());

        int beforeValidation = ordered.size();
        if (properties.getDiscovery().isValidateUrls() && !ordered.isEmpty()) {
            List<DiscoveredUrl> unvalidated = ordered;
            List<DiscoveredUrl> validated = runStep(
                STEP_VALIDATION,
                stepErrors,
                () -> reachabilityValidator.retainReachable(unvalidated)
            );
            if (stepErrors.containsKey(STEP_VALIDATION)) {
                validated = unvalidated;
            }
            ordered = validated;
            stepCounts.put(STEP_VALIDATION, ordered.size());
        }
        int dropped = beforeValidation - ordered.size();
        if (ordered.size() > cap) {
            ordered = new ArrayList<>(ordered.subList(0, cap));
        }

        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        log.info(
            "discovery complete domain={} urls={} sitemap={} homepage={} blog={} droppedUnreachable={} errors={} durationMs={}",
            domain,
            ordered.size(),
            fromSitemap.size(),
            fromHomepage.size(),
            fromBlog.size(),
            dropped,
            stepErrors.keySet(),
            durationMs
        );
        return new DiscoveryResult(
            domain,
            List.copyOf(ordered),
            sitemapsFetched.get(),
            Map.copyOf(stepCounts),
            Map.copyOf(stepErrors),
            dropped,
            durationMs
        );
    }

    private List<DiscoveredUrl> sitemapUrls(String homepageUrl, String siteHost, AtomicInteger sitemapsFetched) {
        String origin = UrlNormalizer.origin(homepageUrl);
        LinkedHashSet<String> seeds = new LinkedHashSet<>();
        seeds.add(origin + "/sitemap.xml");
        seeds.add(origin + "/sitemap_index.xml");
        seeds.addAll(robotsTxtService.getRules(origin).getSitemapUrls());

        ScraperProperties.Sitemap limits = properties.getSitemap();
        SitemapDiscoveryResult sitemaps = sitemapService.discover(
            new ArrayList<>(seeds),
            limits.getMaxDepth(),
            limits.getMaxSitemaps(),
            limits.getMaxUrls()
        );
        sitemapsFetched.set(sitemaps.fetchedSitemaps().size());

        Map<String, DiscoveredUrl> urls = new LinkedHashMap<>();
        for (SitemapUrlEntry entry : sitemaps.discoveredUrls()) {
            String normalized = UrlNormalizer.normalize(entry.url());
            if (!UrlNormalizer.isCrawlable(normalized, siteHost) || urls.containsKey(normalized)) {
                continue;
            }
            double priority = entry.priority() != null ? entry.priority() : PriorityHeuristic.priority(normalized);
            urls.put(normalized, new DiscoveredUrl(
                normalized,
                UrlNormalizer.generateTitle(normalized),
                priority,
                DiscoverySource.SITEMAP,
                entry.lastmod(),
                entry.changefreq()
            ));
        }
        return new ArrayList<>(urls.values());
    }

    /**
     * Highest priority wins; on a tie the entry merged first stays.
     */
    static void mergeInto(Map<String, DiscoveredUrl> merged, List<DiscoveredUrl> incoming) {
        for (DiscoveredUrl candidate : incoming) {
            String key = UrlNormalizer.normalize(candidate.url());
            if (key == null) {
                continue;
            }
            DiscoveredUrl existing = merged.get(key);
            if (existing == null || candidate.priority() > existing.priority()) {
                merged.put(key, key.equals(candidate.url()) ? candidate : new DiscoveredUrl(
                    key,
                    candidate.title(),
                    candidate.priority(),
                    candidate.source(),
                    candidate.lastmod(),
                    candidate.changefreq()
                ));
            }
        }
    }

    private List<DiscoveredUrl> runStep(String step, Map<String, String> stepErrors, Supplier<List<DiscoveredUrl>> body) {
        try {
            List<DiscoveredUrl> result = body.get();
            return result == null ? List.of() : result;
        } catch (RuntimeException e) {
            log.warn("discovery step failed step={} error={}", step, e.getMessage(), e);
            synchronized (stepErrors) {
                stepErrors.put(step, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }
            return List.of();
        }
    }
}
