package com.siteintel.scrape.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.aggregate.DataAggregator;
import com.siteintel.scrape.discovery.DiscoveryCoordinator;
import com.siteintel.scrape.enhance.EnhancementEscalator;
import com.siteintel.scrape.events.EventBusFactory;
import com.siteintel.scrape.events.EventSubscriber;
import com.siteintel.scrape.events.Phase;
import com.siteintel.scrape.events.PhaseTracker;
import com.siteintel.scrape.events.ProgressEventBus;
import com.siteintel.scrape.fetch.AbortSignal;
import com.siteintel.scrape.fetch.BatchFetchExecutor;
import com.siteintel.scrape.fetch.BatchFetchOutcome;
import com.siteintel.scrape.fetch.BatchListener;
import com.siteintel.scrape.fetch.BatchRequest;
import com.siteintel.scrape.fetch.PhaseErrorPolicy;
import com.siteintel.scrape.fetch.ScrapeErrorKind;
import com.siteintel.scrape.model.AggregatedDataset;
import com.siteintel.scrape.model.DatasetMetadata;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoveryResult;
import com.siteintel.scrape.model.EnhancementOutcome;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.RunStatus;
import com.siteintel.scrape.model.RunSummary;
import com.siteintel.scrape.model.ScrapeMode;
import com.siteintel.scrape.model.ScrapeRequest;
import com.siteintel.scrape.model.ScrapeRunResult;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import com.siteintel.scrape.model.ValidationOutcome;
import com.siteintel.scrape.persistence.CheckpointException;
import com.siteintel.scrape.persistence.CheckpointStore;
import com.siteintel.scrape.strategy.FetchContext;
import com.siteintel.scrape.strategy.FetchStrategyRegistry;
import com.siteintel.scrape.strategy.SiteAnalyzer;
import com.siteintel.scrape.strategy.StrategySelector;
import com.siteintel.scrape.util.UrlNormalizer;
import com.siteintel.scrape.validation.ContentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs discovery, rapid scrape, validation and enhancement in order, then aggregates. Requested phases
 * are skipped; an abort or the run deadline ends the run early with whatever was aggregated so far.
 * Exactly one terminal event is published per run.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);
    private static final TypeReference<List<String>> URL_LIST = new TypeReference<>() {
    };

    private final ScraperProperties properties;
    private final Clock clock;
    private final DiscoveryCoordinator discoveryCoordinator;
    private final StrategySelector strategySelector;
    private final ObjectProvider<SiteAnalyzer> siteAnalyzers;
    private final FetchStrategyRegistry strategyRegistry;
    private final BatchFetchExecutor batchFetchExecutor;
    private final ContentValidator contentValidator;
    private final EnhancementEscalator enhancementEscalator;
    private final DataAggregator dataAggregator;
    private final CheckpointStore checkpointStore;
    private final EventBusFactory eventBusFactory;
    private final ScrapeRunRegistry runRegistry;

    public ScrapeOrchestratorService(
        ScraperProperties properties,
        Clock clock,
        DiscoveryCoordinator discoveryCoordinator,
        StrategySelector strategySelector,
        ObjectProvider<SiteAnalyzer> siteAnalyzers,
        FetchStrategyRegistry strategyRegistry,
        BatchFetchExecutor batchFetchExecutor,
        ContentValidator contentValidator,
        EnhancementEscalator enhancementEscalator,
        DataAggregator dataAggregator,
        CheckpointStore checkpointStore,
        EventBusFactory eventBusFactory,
        ScrapeRunRegistry runRegistry
    ) {
        this.properties = properties;
        this.clock = clock;
        this.discoveryCoordinator = discoveryCoordinator;
        this.strategySelector = strategySelector;
        this.siteAnalyzers = siteAnalyzers;
        this.strategyRegistry = strategyRegistry;
        this.batchFetchExecutor = batchFetchExecutor;
        this.contentValidator = contentValidator;
        this.enhancementEscalator = enhancementEscalator;
        this.dataAggregator = dataAggregator;
        this.checkpointStore = checkpointStore;
        this.eventBusFactory = eventBusFactory;
        this.runRegistry = runRegistry;
    }

    public ScrapeRunResult run(ScrapeRequest request, EventSubscriber subscriber) {
        String homepageUrl = UrlNormalizer.homepageUrl(request.domain());
        String correlationId = isBlank(request.correlationId()) ? UUID.randomUUID().toString() : request.correlationId().trim();
        String sessionId = isBlank(request.sessionId()) ? correlationId : request.sessionId().trim();
        Instant startedAt = clock.instant();
        int maxDurationSeconds = request.timeoutSeconds() != null
            ? Math.max(1, request.timeoutSeconds())
            : properties.getRun().getMaxDurationSeconds();
        Instant deadline = maxDurationSeconds > 0 ? startedAt.plusSeconds(maxDurationSeconds) : null;
        AbortSignal signal = new AbortSignal(clock, deadline);
        EventSubscriber target = subscriber == null ? event -> {
        } : subscriber;

        runRegistry.register(correlationId, signal);
        log.info(
            "scrape run started correlationId={} session={} domain={} mode={} skip={}",
            correlationId,
            sessionId,
            request.domain(),
            request.mode(),
            request.effectiveSkipPhases()
        );
        try (ProgressEventBus bus = eventBusFactory.create(correlationId, target)) {
            RunContext run = new RunContext(
                request,
                homepageUrl,
                correlationId,
                sessionId,
                startedAt,
                signal,
                bus,
                new PhaseTracker(request.effectiveSkipPhases())
            );
            return execute(run);
        } finally {
            runRegistry.remove(correlationId);
        }
    }

    private ScrapeRunResult execute(RunContext run) {
        try {
            List<String> urls = discover(run);
            if (run.signal.isAborted()) {
                return finishAborted(run);
            }
            SiteMetadata siteMetadata = analyzeSite(run);
            StrategyKind strategy = chooseStrategy(run, siteMetadata);
            urls = excludeAlreadyScraped(run, urls);

            rapidScrape(run, urls, strategy, siteMetadata);
            if (run.signal.isAborted()) {
                return finishAborted(run);
            }
            ValidationOutcome validation = validate(run);
            if (run.signal.isAborted()) {
                return finishAborted(run);
            }
            enhance(run, validation, siteMetadata);
            if (run.signal.isAborted()) {
                return finishAborted(run);
            }
            return finishCompleted(run);
        } catch (CheckpointException e) {
            return finishFailed(run, ScrapeErrorKind.PERSISTENCE, e);
        } catch (RuntimeException e) {
            return finishFailed(run, ScrapeErrorKind.UNEXPECTED, e);
        }
    }

    private List<String> discover(RunContext run) {
        int maxPages = run.request.maxPages() != null
            ? Math.max(1, run.request.maxPages())
            : properties.getDiscovery().getMaxPages();
        if (run.tracker.isSkipRequested(Phase.DISCOVERY)) {
            skipPhase(run, Phase.DISCOVERY);
            LinkedHashSet<String> urls = new LinkedHashSet<>();
            for (String url : run.request.urls()) {
                String normalized = UrlNormalizer.normalize(url);
                if (normalized != null && urls.size() < maxPages) {
                    urls.add(normalized);
                }
            }
            if (urls.isEmpty()) {
                urls.add(run.homepageUrl);
            }
            return new ArrayList<>(urls);
        }

        beginPhase(run, Phase.DISCOVERY);
        DiscoveryResult result = discoveryCoordinator.discover(run.request.domain(), maxPages);
        List<String> urls = new ArrayList<>();
        for (DiscoveredUrl discovered : result.urls()) {
            urls.add(discovered.url());
        }
        if (urls.isEmpty()) {
            log.warn("discovery found nothing, falling back to homepage correlationId={} domain={}",
                run.correlationId, run.request.domain());
            urls.add(run.homepageUrl);
        }
        checkpointStore.upsert(run.sessionId, CheckpointStore.DISCOVERED_URLS, result.urls());
        run.bus.data(Phase.DISCOVERY, "discovery:urls", payload("urls", urls));
        Map<String, Object> summary = payload("urlsFound", result.urls().size());
        summary.put("sitemapsFetched", result.sitemapsFetched());
        summary.put("droppedUnreachable", result.droppedUnreachable());
        summary.put("stepErrors", result.stepErrors());
        completePhase(run, Phase.DISCOVERY, summary);
        return urls;
    }

    private SiteMetadata analyzeSite(RunContext run) {
        SiteAnalyzer analyzer = siteAnalyzers.getIfAvailable();
        if (analyzer == null) {
            return SiteMetadata.unknown();
        }
        try {
            SiteMetadata metadata = analyzer.analyze(run.homepageUrl);
            return metadata == null ? SiteMetadata.unknown() : metadata;
        } catch (RuntimeException e) {
            log.warn("site analysis failed correlationId={} url={}", run.correlationId, run.homepageUrl, e);
            return SiteMetadata.unknown();
        }
    }

    private StrategyKind chooseStrategy(RunContext run, SiteMetadata siteMetadata) {
        StrategyKind selected = strategySelector.select(siteMetadata);
        if (run.request.mode() == ScrapeMode.DYNAMIC) {
            selected = strategyRegistry.escalationTarget(selected);
        }
        run.strategy = selected;
        run.bus.notify(
            Phase.RAPID_SCRAPE,
            "strategy:selected",
            "Using " + selected.wireName() + " strategy"
                + (siteMetadata.hasTechnology() ? " for " + siteMetadata.technology() : ""),
            "info"
        );
        return selected;
    }

    private List<String> excludeAlreadyScraped(RunContext run, List<String> urls) {
        if (run.request.mode() != ScrapeMode.INCREMENTAL) {
            return urls;
        }
        List<String> previous = checkpointStore.find(run.sessionId, CheckpointStore.SCRAPED_URLS, URL_LIST)
            .orElse(List.of());
        run.previouslyScraped.addAll(previous);
        List<String> remaining = new ArrayList<>();
        for (String url : urls) {
            if (!run.previouslyScraped.contains(url)) {
                remaining.add(url);
            }
        }
        log.info("incremental run correlationId={} previouslyScraped={} remaining={}",
            run.correlationId, previous.size(), remaining.size());
        return remaining;
    }

    private void rapidScrape(RunContext run, List<String> urls, StrategyKind strategy, SiteMetadata siteMetadata) {
        if (run.tracker.isSkipRequested(Phase.RAPID_SCRAPE)) {
            skipPhase(run, Phase.RAPID_SCRAPE);
            return;
        }
        beginPhase(run, Phase.RAPID_SCRAPE);
        BatchRequest batchRequest = new BatchRequest(
            fetchContext(run),
            siteMetadata,
            properties.getFetch().getBatchSize(),
            properties.getFetch().getInterBatchDelayMs(),
            PhaseErrorPolicy.rapidScrape(properties),
            run.signal,
            batchListener(run, Phase.RAPID_SCRAPE)
        );
        BatchFetchOutcome outcome = batchFetchExecutor.fetchAll(urls, strategyRegistry.resolve(strategy), batchRequest);
        run.pages = new ArrayList<>(outcome.records());
        run.attempted = outcome.attempted();
        run.failed = outcome.failed();

        Set<String> scraped = new LinkedHashSet<>(run.previouslyScraped);
        for (PageRecord page : run.pages) {
            if (page != null) {
                scraped.add(page.url());
                Map<String, Object> data = payload("url", page.url());
                data.put("title", page.title());
                data.put("strategy", page.strategy() == null ? null : page.strategy().wireName());
                run.bus.data(Phase.RAPID_SCRAPE, "rapid-scrape:page:" + page.url(), data);
            }
        }
        checkpointStore.upsert(run.sessionId, CheckpointStore.SCRAPED_URLS, new ArrayList<>(scraped));
        if (outcome.succeeded() == 0 && outcome.attempted() > 0) {
            run.bus.notify(Phase.RAPID_SCRAPE, "rapid-scrape:empty", "No page returned content", "warning");
        }

        Map<String, Object> summary = payload("attempted", outcome.attempted());
        summary.put("succeeded", outcome.succeeded());
        summary.put("failed", outcome.failed());
        summary.put("notAttempted", outcome.notAttempted());
        completePhase(run, Phase.RAPID_SCRAPE, summary);
    }

    private ValidationOutcome validate(RunContext run) {
        if (run.tracker.isSkipRequested(Phase.VALIDATION)) {
            skipPhase(run, Phase.VALIDATION);
            return null;
        }
        beginPhase(run, Phase.VALIDATION);
        ValidationOutcome outcome = contentValidator.validate(run.pages);
        run.validationScore = outcome.averageScore();
        Map<String, Object> summary = payload("accepted", outcome.accepted().size());
        summary.put("needsEnhancement", outcome.needsEnhancement().size());
        summary.put("averageScore", outcome.averageScore());
        completePhase(run, Phase.VALIDATION, summary);
        return outcome;
    }

    private void enhance(RunContext run, ValidationOutcome validation, SiteMetadata siteMetadata) {
        if (run.tracker.isSkipRequested(Phase.ENHANCEMENT)
            || validation == null
            || validation.needsEnhancement().isEmpty()) {
            skipPhase(run, Phase.ENHANCEMENT);
            return;
        }
        beginPhase(run, Phase.ENHANCEMENT);
        EnhancementOutcome outcome = enhancementEscalator.enhance(
            run.pages,
            validation.needsEnhancement(),
            run.strategy,
            fetchContext(run),
            siteMetadata,
            run.signal,
            batchListener(run, Phase.ENHANCEMENT)
        );
        run.pages = new ArrayList<>(outcome.pages());
        run.enhanced = outcome.enhanced();
        Map<String, Object> summary = payload("candidates", validation.needsEnhancement().size());
        summary.put("enhanced", outcome.enhanced());
        summary.put("keptOriginal", outcome.failed());
        completePhase(run, Phase.ENHANCEMENT, summary);
    }

    private ScrapeRunResult finishCompleted(RunContext run) {
        AggregatedDataset dataset = aggregate(run);
        checkpointStore.upsert(run.sessionId, CheckpointStore.DATASET, dataset);
        run.tracker.start(Phase.COMPLETE);
        run.tracker.complete(Phase.COMPLETE);
        RunSummary summary = summarize(run, false);
        run.bus.complete(completionPayload(run, summary, RunStatus.COMPLETED));
        log.info(
            "scrape run complete correlationId={} phases={} pages={} failed={} enhanced={} score={} durationMs={}",
            run.correlationId,
            summary.phasesRun(),
            summary.pagesSucceeded(),
            summary.pagesFailed(),
            summary.enhancementCount(),
            summary.validationScore(),
            summary.durationMs()
        );
        return result(run, RunStatus.COMPLETED, dataset, summary, null);
    }

    private ScrapeRunResult finishAborted(RunContext run) {
        String reason = run.signal.reason();
        run.tracker.skipRemaining();
        AggregatedDataset dataset = aggregate(run);
        RunSummary summary = summarize(run, true);
        Map<String, Object> payload = completionPayload(run, summary, RunStatus.ABORTED);
        payload.put("reason", reason);
        run.bus.complete(payload);
        log.info("scrape run stopped early correlationId={} reason={} pages={}",
            run.correlationId, reason, summary.pagesSucceeded());
        return result(run, RunStatus.ABORTED, dataset, summary, reason);
    }

    private ScrapeRunResult finishFailed(RunContext run, ScrapeErrorKind kind, RuntimeException error) {
        log.error("scrape run failed correlationId={} phase={} kind={}",
            run.correlationId, run.currentPhase == null ? null : run.currentPhase.wireName(), kind, error);
        if (run.currentPhase != null) {
            run.tracker.failIfRunning(run.currentPhase);
        }
        run.tracker.skipRemaining();
        AggregatedDataset dataset = aggregate(run);
        RunSummary summary = summarize(run, true);
        String message = kind.name().toLowerCase(Locale.ROOT) + ": " + error.getMessage();
        run.bus.error(run.currentPhase, "run:failed", message, true);
        return result(run, RunStatus.FAILED, dataset, summary, message);
    }

    private AggregatedDataset aggregate(RunContext run) {
        AggregatedDataset dataset = dataAggregator.aggregate(run.pages);
        DatasetMetadata merged = new DatasetMetadata(
            dataset.metadata().pagesScraped(),
            run.attempted,
            run.failed,
            run.enhanced,
            run.validationScore,
            dataset.metadata().scraperUsed(),
            elapsedMs(run)
        );
        return dataset.withMetadata(merged);
    }

    private RunSummary summarize(RunContext run, boolean partial) {
        int succeeded = 0;
        for (PageRecord page : run.pages) {
            if (page != null) {
                succeeded++;
            }
        }
        return new RunSummary(
            run.tracker.phasesRun(),
            run.attempted,
            succeeded,
            run.failed,
            run.validationScore,
            run.enhanced,
            elapsedMs(run),
            partial
        );
    }

    private Map<String, Object> completionPayload(RunContext run, RunSummary summary, RunStatus status) {
        Map<String, Object> payload = payload("status", status.name().toLowerCase(Locale.ROOT));
        payload.put("phasesRun", summary.phasesRun());
        payload.put("pageCount", summary.pagesSucceeded());
        payload.put("totalAttempted", summary.totalAttempted());
        payload.put("failedCount", summary.pagesFailed());
        payload.put("validationScore", summary.validationScore());
        payload.put("enhancementCount", summary.enhancementCount());
        payload.put("durationMs", summary.durationMs());
        payload.put("partial", summary.partial());
        payload.put("sessionId", run.sessionId);
        return payload;
    }

    private ScrapeRunResult result(
        RunContext run,
        RunStatus status,
        AggregatedDataset dataset,
        RunSummary summary,
        String errorMessage
    ) {
        return new ScrapeRunResult(
            run.correlationId,
            run.sessionId,
            run.request.domain(),
            status,
            dataset,
            summary,
            errorMessage
        );
    }

    private BatchListener batchListener(RunContext run, Phase phase) {
        return progress -> {
            Map<String, Object> payload = payload("batch", progress.batchNumber());
            payload.put("totalBatches", progress.totalBatches());
            payload.put("completed", progress.completed());
            payload.put("succeeded", progress.succeeded());
            payload.put("failed", progress.failed());
            payload.put("total", progress.total());
            run.bus.progress(phase, phase.wireName() + ":batch-" + progress.batchNumber(), payload);
        };
    }

    private FetchContext fetchContext(RunContext run) {
        return new FetchContext(
            run.correlationId,
            run.sessionId,
            Duration.ofSeconds(properties.getFetch().getPageTimeoutSeconds())
        );
    }

    private void beginPhase(RunContext run, Phase phase) {
        run.tracker.start(phase);
        run.currentPhase = phase;
        run.bus.progress(phase, phase.wireName() + ":started", payload("status", "in-progress"));
    }

    private void completePhase(RunContext run, Phase phase, Map<String, Object> summary) {
        run.tracker.complete(phase);
        summary.put("status", "complete");
        run.bus.progress(phase, phase.wireName() + ":complete", summary);
        log.info("phase complete correlationId={} phase={} summary={}", run.correlationId, phase.wireName(), summary);
    }

    private void skipPhase(RunContext run, Phase phase) {
        run.tracker.skip(phase);
        run.bus.progress(phase, phase.wireName() + ":skipped", payload("status", "skipped"));
    }

    private long elapsedMs(RunContext run) {
        return Math.max(0L, Duration.between(run.startedAt, clock.instant()).toMillis());
    }

    private static Map<String, Object> payload(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class RunContext {
        private final ScrapeRequest request;
        private final String homepageUrl;
        private final String correlationId;
        private final String sessionId;
        private final Instant startedAt;
        private final AbortSignal signal;
        private final ProgressEventBus bus;
        private final PhaseTracker tracker;
        private final Set<String> previouslyScraped = new LinkedHashSet<>();
        private List<PageRecord> pages = new ArrayList<>();
        private StrategyKind strategy = StrategyKind.DYNAMIC;
        private Phase currentPhase;
        private int attempted;
        private int failed;
        private int enhanced;
        private double validationScore;

        private RunContext(
            ScrapeRequest request,
            String homepageUrl,
            String correlationId,
            String sessionId,
            Instant startedAt,
            AbortSignal signal,
            ProgressEventBus bus,
            PhaseTracker tracker
        ) {
            this.request = request;
            this.homepageUrl = homepageUrl;
            this.correlationId = correlationId;
            this.sessionId = sessionId;
            this.startedAt = startedAt;
            this.signal = signal;
            this.bus = bus;
            this.tracker = tracker;
        }
    }
}
