package com.siteintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "site-intel/0.1 (+https://siteintel.example/bot)";

    private String userAgent;
    private int perHostDelayMs = 250;
    private int globalConcurrency = 8;
    private int perHostConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private Discovery discovery = new Discovery();
    private Sitemap sitemap = new Sitemap();
    private Fetch fetch = new Fetch();
    private Validation validation = new Validation();
    private Enhancement enhancement = new Enhancement();
    private Aggregation aggregation = new Aggregation();
    private Events events = new Events();
    private Run run = new Run();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Sitemap getSitemap() {
        return sitemap;
    }

    public void setSitemap(Sitemap sitemap) {
        this.sitemap = sitemap;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Enhancement getEnhancement() {
        return enhancement;
    }

    public void setEnhancement(Enhancement enhancement) {
        this.enhancement = enhancement;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Discovery {
        private int maxPages = 200;
        private boolean patternDiscoveryEnabled = false;
        private int maxBlogPages = 3;
        private int maxLinksPerPage = 200;
        private boolean validateUrls = true;
        private int validationConcurrency = 8;

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public boolean isPatternDiscoveryEnabled() {
            return patternDiscoveryEnabled;
        }

        public void setPatternDiscoveryEnabled(boolean patternDiscoveryEnabled) {
            this.patternDiscoveryEnabled = patternDiscoveryEnabled;
        }

        public int getMaxBlogPages() {
            return Math.max(1, maxBlogPages);
        }

        public void setMaxBlogPages(int maxBlogPages) {
            this.maxBlogPages = Math.max(1, maxBlogPages);
        }

        public int getMaxLinksPerPage() {
            return Math.max(1, maxLinksPerPage);
        }

        public void setMaxLinksPerPage(int maxLinksPerPage) {
            this.maxLinksPerPage = Math.max(1, maxLinksPerPage);
        }

        public boolean isValidateUrls() {
            return validateUrls;
        }

        public void setValidateUrls(boolean validateUrls) {
            this.validateUrls = validateUrls;
        }

        public int getValidationConcurrency() {
            return Math.max(1, validationConcurrency);
        }

        public void setValidationConcurrency(int validationConcurrency) {
            this.validationConcurrency = Math.max(1, validationConcurrency);
        }
    }

    public static class Sitemap {
        private int maxDepth = 3;
        private int maxSitemaps = 25;
        private int maxUrls = 500;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getMaxSitemaps() {
            return maxSitemaps;
        }

        public void setMaxSitemaps(int maxSitemaps) {
            this.maxSitemaps = maxSitemaps;
        }

        public int getMaxUrls() {
            return maxUrls;
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }
    }

    public static class Fetch {
        private int batchSize = 5;
        private int interBatchDelayMs = 500;
        private int pageTimeoutSeconds = 30;
        private int maxToleratedFailures = -1;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getInterBatchDelayMs() {
            return Math.max(0, interBatchDelayMs);
        }

        public void setInterBatchDelayMs(int interBatchDelayMs) {
            this.interBatchDelayMs = Math.max(0, interBatchDelayMs);
        }

        public int getPageTimeoutSeconds() {
            return Math.max(1, pageTimeoutSeconds);
        }

        public void setPageTimeoutSeconds(int pageTimeoutSeconds) {
            this.pageTimeoutSeconds = Math.max(1, pageTimeoutSeconds);
        }

        public int getMaxToleratedFailures() {
            return maxToleratedFailures;
        }

        public void setMaxToleratedFailures(int maxToleratedFailures) {
            this.maxToleratedFailures = maxToleratedFailures;
        }
    }

    public static class Validation {
        private int minContentLength = 500;
        private double acceptThreshold = 0.5;

        public int getMinContentLength() {
            return Math.max(1, minContentLength);
        }

        public void setMinContentLength(int minContentLength) {
            this.minContentLength = Math.max(1, minContentLength);
        }

        public double getAcceptThreshold() {
            return Math.max(0.0, Math.min(1.0, acceptThreshold));
        }

        public void setAcceptThreshold(double acceptThreshold) {
            this.acceptThreshold = Math.max(0.0, Math.min(1.0, acceptThreshold));
        }
    }

    public static class Enhancement {
        private int batchSize = 2;
        private int interBatchDelayMs = 500;
        private int maxToleratedFailures = -1;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getInterBatchDelayMs() {
            return Math.max(0, interBatchDelayMs);
        }

        public void setInterBatchDelayMs(int interBatchDelayMs) {
            this.interBatchDelayMs = Math.max(0, interBatchDelayMs);
        }

        public int getMaxToleratedFailures() {
            return maxToleratedFailures;
        }

        public void setMaxToleratedFailures(int maxToleratedFailures) {
            this.maxToleratedFailures = maxToleratedFailures;
        }
    }

    public static class Aggregation {
        private int maxColors = 10;
        private int maxFonts = 5;

        public int getMaxColors() {
            return Math.max(1, maxColors);
        }

        public void setMaxColors(int maxColors) {
            this.maxColors = Math.max(1, maxColors);
        }

        public int getMaxFonts() {
            return Math.max(1, maxFonts);
        }

        public void setMaxFonts(int maxFonts) {
            this.maxFonts = Math.max(1, maxFonts);
        }
    }

    public static class Events {
        private int dedupTtlSeconds = 10;
        private int sweepIntervalSeconds = 60;
        private int notificationWindowMs = 2000;

        public int getDedupTtlSeconds() {
            return Math.max(1, dedupTtlSeconds);
        }

        public void setDedupTtlSeconds(int dedupTtlSeconds) {
            this.dedupTtlSeconds = Math.max(1, dedupTtlSeconds);
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = Math.max(1, sweepIntervalSeconds);
        }

        public int getNotificationWindowMs() {
            return Math.max(1, notificationWindowMs);
        }

        public void setNotificationWindowMs(int notificationWindowMs) {
            this.notificationWindowMs = Math.max(1, notificationWindowMs);
        }
    }

    public static class Run {
        private int maxDurationSeconds = 300;

        public int getMaxDurationSeconds() {
            return maxDurationSeconds;
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = maxDurationSeconds;
        }
    }

    public static class Cli {
        private boolean run;
        private String domain = "";
        private String skipPhases = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public String getSkipPhases() {
            return skipPhases;
        }

        public void setSkipPhases(String skipPhases) {
            this.skipPhases = skipPhases;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
