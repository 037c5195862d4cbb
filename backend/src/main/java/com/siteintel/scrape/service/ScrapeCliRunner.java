package com.siteintel.scrape.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.events.Phase;
import com.siteintel.scrape.model.RunSummary;
import com.siteintel.scrape.model.ScrapeRequest;
import com.siteintel.scrape.model.ScrapeRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScrapeRequest request = new ScrapeRequest(
            properties.getCli().getDomain(),
            null,
            null,
            null,
            null,
            parseSkipPhases(properties.getCli().getSkipPhases()),
            null,
            null
        );
        ScrapeRunResult result = orchestratorService.run(request, event -> log.debug(
            "event {} phase={} source={}",
            event.type().wireName(),
            event.phase() == null ? null : event.phase().wireName(),
            event.sourceId()
        ));
        RunSummary summary = result.summary();
        log.info(
            "Scrape run {} finished with status {}: phases={}, pages={}/{}, enhanced={}, score={}",
            result.correlationId(),
            result.status(),
            summary.phasesRun(),
            summary.pagesSucceeded(),
            summary.totalAttempted(),
            summary.enhancementCount(),
            summary.validationScore()
        );
        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static Set<Phase> parseSkipPhases(String raw) {
        Set<Phase> phases = EnumSet.noneOf(Phase.class);
        if (raw == null || raw.isBlank()) {
            return phases;
        }
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .map(Phase::fromWireName)
            .forEach(phases::add);
        return phases;
    }
}
