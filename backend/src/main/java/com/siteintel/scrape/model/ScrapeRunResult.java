package com.siteintel.scrape.model;

public record ScrapeRunResult(
    String correlationId,
    String sessionId,
    String domain,
    RunStatus status,
    AggregatedDataset dataset,
    RunSummary summary,
    String errorMessage
) {
}
