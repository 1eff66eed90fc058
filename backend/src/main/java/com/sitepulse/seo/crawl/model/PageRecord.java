package com.sitepulse.seo.crawl.model;

/**
 * One visited URL and what was learned about it. {@code statusCode == 0} means the fetch never got an
 * HTTP response.
 */
public record PageRecord(
    String url,
    int statusCode,
    String title,
    String metaDescription,
    String canonical,
    String h1,
    int h2Count,
    int imgCount,
    int imgWithAlt,
    int wordCount
) {
    public static PageRecord of(String url, int statusCode, PageMetadata metadata) {
        PageMetadata safe = metadata == null ? PageMetadata.EMPTY : metadata;
        return new PageRecord(
            url,
            statusCode,
            safe.title(),
            safe.metaDescription(),
            safe.canonical(),
            safe.h1(),
            safe.h2Count(),
            safe.imgCount(),
            safe.imgWithAlt(),
            safe.wordCount()
        );
    }

    public static PageRecord failed(String url) {
        return of(url, 0, PageMetadata.EMPTY);
    }
}
