package com.sitepulse.seo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (compatible; SitePulseSeoBot/1.0; +https://sitepulse.dev/bot)";
    private static final int DEFAULT_MAX_BODY_BYTES = 5 * 1024 * 1024;

    private String userAgent;
    private int perHostDelayMs = 100;
    private int requestTimeoutSeconds = 20;
    private int maxBodyBytes = DEFAULT_MAX_BODY_BYTES;
    private int maxPages = 500;
    private int httpThreads = 8;
    private int streamTimeoutSeconds = 0;
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

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getMaxBodyBytes() {
        return maxBodyBytes <= 0 ? DEFAULT_MAX_BODY_BYTES : maxBodyBytes;
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public int getMaxPages() {
        return Math.max(1, maxPages);
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(1, maxPages);
    }

    public int getHttpThreads() {
        return Math.max(1, httpThreads);
    }

    public void setHttpThreads(int httpThreads) {
        this.httpThreads = Math.max(1, httpThreads);
    }

    public int getStreamTimeoutSeconds() {
        return Math.max(0, streamTimeoutSeconds);
    }

    public void setStreamTimeoutSeconds(int streamTimeoutSeconds) {
        this.streamTimeoutSeconds = Math.max(0, streamTimeoutSeconds);
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Resolves the page budget for one crawl: the configured maximum when no override is given,
     * otherwise the override clamped to {@code [1, maxPages]}.
     */
    public int resolveBudget(Integer requested) {
        if (requested == null) {
            return getMaxPages();
        }
        return Math.min(getMaxPages(), Math.max(1, requested));
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Cli {
        private boolean run;
        private String domain = "";
        private int maxPages;
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
            this.domain = domain == null ? "" : domain.trim();
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
