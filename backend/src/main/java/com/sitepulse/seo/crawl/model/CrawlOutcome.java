package com.sitepulse.seo.crawl.model;

public enum CrawlOutcome {
    COMPLETED,
    CANCELLED
}
