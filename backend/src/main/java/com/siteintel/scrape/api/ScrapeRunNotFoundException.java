package com.siteintel.scrape.api;

public class ScrapeRunNotFoundException extends RuntimeException {
    public ScrapeRunNotFoundException(String correlationId) {
        super("No active run with correlationId " + correlationId);
    }
}
