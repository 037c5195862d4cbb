package com.siteintel.scrape.api;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.discovery.DiscoveryCoordinator;
import com.siteintel.scrape.events.ProgressEventCodec;
import com.siteintel.scrape.events.SseEventStreamWriter;
import com.siteintel.scrape.model.DiscoveryResult;
import com.siteintel.scrape.model.ScrapeRequest;
import com.siteintel.scrape.model.ScrapeRunResult;
import com.siteintel.scrape.service.ScrapeOrchestratorService;
import com.siteintel.scrape.service.ScrapeRunRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private static final Logger log = LoggerFactory.getLogger(ScrapeController.class);
    private static final long STREAM_GRACE_SECONDS = 30;

    private final ScrapeOrchestratorService orchestratorService;
    private final ScrapeRunRegistry runRegistry;
    private final DiscoveryCoordinator discoveryCoordinator;
    private final ProgressEventCodec eventCodec;
    private final ScraperProperties properties;
    private final ExecutorService scrapeRunExecutor;

    public ScrapeController(
        ScrapeOrchestratorService orchestratorService,
        ScrapeRunRegistry runRegistry,
        DiscoveryCoordinator discoveryCoordinator,
        ProgressEventCodec eventCodec,
        ScraperProperties properties,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor
    ) {
        this.orchestratorService = orchestratorService;
        this.runRegistry = runRegistry;
        this.discoveryCoordinator = discoveryCoordinator;
        this.eventCodec = eventCodec;
        this.properties = properties;
        this.scrapeRunExecutor = scrapeRunExecutor;
    }

    @PostMapping("/scrape/run")
    public ScrapeRunResult runScrape(@RequestBody ScrapeApiRunRequest request) {
        return orchestratorService.run(request.toScrapeRequest(request.correlationId()), null);
    }

    @PostMapping(path = "/scrape/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamScrape(@RequestBody ScrapeApiRunRequest request) {
        String correlationId = request.correlationId() == null || request.correlationId().isBlank()
            ? UUID.randomUUID().toString()
            : request.correlationId().trim();
        ScrapeRequest scrapeRequest = request.toScrapeRequest(correlationId);
        int runSeconds = scrapeRequest.timeoutSeconds() != null
            ? Math.max(1, scrapeRequest.timeoutSeconds())
            : properties.getRun().getMaxDurationSeconds();

        SseEmitter emitter = new SseEmitter((runSeconds + STREAM_GRACE_SECONDS) * 1000L);
        SseEventStreamWriter writer = new SseEventStreamWriter(emitter, eventCodec);
        emitter.onCompletion(writer::markClosed);
        emitter.onTimeout(() -> {
            writer.markClosed();
            runRegistry.abort(correlationId);
        });
        emitter.onError(error -> {
            writer.markClosed();
            runRegistry.abort(correlationId);
        });

        try {
            scrapeRunExecutor.submit(() -> {
                try {
                    orchestratorService.run(scrapeRequest, writer);
                } catch (RuntimeException e) {
                    log.warn("streamed scrape run failed to start correlationId={}", correlationId, e);
                    emitter.completeWithError(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("scrape run rejected correlationId={}", correlationId, e);
            emitter.completeWithError(e);
        }
        return emitter;
    }

    @PostMapping("/scrape/{correlationId}/abort")
    public Map<String, Object> abortScrape(@PathVariable("correlationId") String correlationId) {
        if (!runRegistry.abort(correlationId)) {
            throw new ScrapeRunNotFoundException(correlationId);
        }
        log.info("abort requested correlationId={}", correlationId);
        return Map.of("correlationId", correlationId, "aborted", true);
    }

    @GetMapping("/discovery")
    public DiscoveryResult discover(
        @RequestParam(name = "domain") String domain,
        @RequestParam(name = "maxPages", required = false) Integer maxPages
    ) {
        int limit = maxPages == null ? properties.getDiscovery().getMaxPages() : Math.max(1, maxPages);
        return discoveryCoordinator.discover(domain, limit);
    }
}
