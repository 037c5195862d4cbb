package com.siteintel.scrape.fetch;

import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.strategy.FetchContext;

public record BatchRequest(
    FetchContext context,
    SiteMetadata siteMetadata,
    int batchSize,
    long interBatchDelayMs,
    PhaseErrorPolicy errorPolicy,
    AbortSignal abortSignal,
    BatchListener listener
) {
    public BatchRequest {
        batchSize = Math.max(1, batchSize);
        interBatchDelayMs = Math.max(0L, interBatchDelayMs);
        abortSignal = abortSignal == null ? AbortSignal.none() : abortSignal;
        listener = listener == null ? BatchListener.noop() : listener;
    }
}
