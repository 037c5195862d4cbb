package com.siteintel.scrape.enhance;

import com.siteintel.config.ScraperProperties;
import com.siteintel.scrape.fetch.AbortSignal;
import com.siteintel.scrape.fetch.BatchFetchExecutor;
import com.siteintel.scrape.fetch.BatchFetchOutcome;
import com.siteintel.scrape.fetch.BatchListener;
import com.siteintel.scrape.fetch.BatchRequest;
import com.siteintel.scrape.fetch.PhaseErrorPolicy;
import com.siteintel.scrape.fetch.ScrapeErrorKind;
import com.siteintel.scrape.model.EnhancementCandidate;
import com.siteintel.scrape.model.EnhancementOutcome;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;
import com.siteintel.scrape.strategy.FetchContext;
import com.siteintel.scrape.strategy.FetchStrategy;
import com.siteintel.scrape.strategy.FetchStrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-fetches flagged pages with the next heavier strategy. A successful re-fetch replaces the page at its
 * original position; a failed one leaves the original record in place.
 */
@Service
public class EnhancementEscalator {
    private static final Logger log = LoggerFactory.getLogger(EnhancementEscalator.class);

    private final BatchFetchExecutor batchFetchExecutor;
    private final FetchStrategyRegistry strategyRegistry;
    private final ScraperProperties properties;

    public EnhancementEscalator(
        BatchFetchExecutor batchFetchExecutor,
        FetchStrategyRegistry strategyRegistry,
        ScraperProperties properties
    ) {
        this.batchFetchExecutor = batchFetchExecutor;
        this.strategyRegistry = strategyRegistry;
        this.properties = properties;
    }

    public EnhancementOutcome enhance(
        List<PageRecord> pages,
        List<EnhancementCandidate> candidates,
        StrategyKind currentStrategy,
        FetchContext context,
        SiteMetadata siteMetadata,
        AbortSignal abortSignal,
        BatchListener listener
    ) {
        List<PageRecord> finalPages = new ArrayList<>(pages);
        if (candidates.isEmpty()) {
            return new EnhancementOutcome(finalPages, 0, 0, 0);
        }

        FetchStrategy strategy = strategyRegistry.resolveEscalation(currentStrategy);
        List<String> urls = new ArrayList<>(candidates.size());
        List<PageRecord> originals = new ArrayList<>(candidates.size());
        for (EnhancementCandidate candidate : candidates) {
            urls.add(candidate.page().url());
            originals.add(candidate.page());
        }
        BatchRequest request = new BatchRequest(
            context,
            siteMetadata,
            properties.getEnhancement().getBatchSize(),
            properties.getEnhancement().getInterBatchDelayMs(),
            PhaseErrorPolicy.enhancement(properties),
            abortSignal,
            listener
        );
        BatchFetchOutcome outcome = batchFetchExecutor.fetchAll(urls, originals, strategy, request);

        int enhanced = 0;
        int failed = 0;
        for (int i = 0; i < candidates.size(); i++) {
            EnhancementCandidate candidate = candidates.get(i);
            finalPages.set(candidate.index(), outcome.records().get(i));
            if (outcome.fetched(i)) {
                enhanced++;
            } else {
                failed++;
                log.debug("enhancement kept original url={} kind={} reason={}",
                    candidate.page().url(), ScrapeErrorKind.ENHANCEMENT_FAILURE, candidate.reason());
            }
        }
        log.info(
            "enhancement complete strategy={} candidates={} enhanced={} keptOriginal={}",
            strategy.kind(),
            candidates.size(),
            enhanced,
            failed
        );
        return new EnhancementOutcome(finalPages, outcome.attempted(), enhanced, failed);
    }
}
