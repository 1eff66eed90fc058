package com.sitepulse.seo.crawl.model;

/**
 * On-page SEO signals read from one HTML document. Strings are never null; an absent element is an
 * empty string.
 */
public record PageMetadata(
    String title,
    String metaDescription,
    String canonical,
    String h1,
    int h2Count,
    int imgCount,
    int imgWithAlt,
    int wordCount
) {
    public static final PageMetadata EMPTY = new PageMetadata("", "", "", "", 0, 0, 0, 0);

    public PageMetadata {
        title = title == null ? "" : title;
        metaDescription = metaDescription == null ? "" : metaDescription;
        canonical = canonical == null ? "" : canonical;
        h1 = h1 == null ? "" : h1;
    }
}
