package com.sitepulse.seo.crawl.model;

import java.time.Duration;
import java.util.List;

public record CrawlSummary(
    String seedUrl,
    int budget,
    List<PageRecord> results,
    int failedPages,
    Duration elapsed,
    CrawlOutcome outcome
) {
    public int pagesVisited() {
        return results.size();
    }
}
