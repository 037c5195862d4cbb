package com.siteintel.scrape.fetch;

public class PageFetchException extends RuntimeException {
    private final ScrapeErrorKind kind;
    private final String url;

    public PageFetchException(ScrapeErrorKind kind, String url, String message) {
        super(message);
        this.kind = kind;
        this.url = url;
    }

    public PageFetchException(ScrapeErrorKind kind, String url, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
    }

    public ScrapeErrorKind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }
}
