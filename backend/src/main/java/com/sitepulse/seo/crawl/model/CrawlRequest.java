package com.sitepulse.seo.crawl.model;

/**
 * A validated crawl: normalized seed URL, the host every enqueued link must share, and the page budget.
 */
public record CrawlRequest(String seedUrl, String baseHost, int budget) {
}
