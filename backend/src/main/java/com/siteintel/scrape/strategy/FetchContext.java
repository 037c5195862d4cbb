package com.siteintel.scrape.strategy;

import java.time.Duration;

public record FetchContext(
    String correlationId,
    String sessionId,
    Duration pageTimeout
) {
}
