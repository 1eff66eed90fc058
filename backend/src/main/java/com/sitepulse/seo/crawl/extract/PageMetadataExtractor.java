package com.sitepulse.seo.crawl.extract;

import com.sitepulse.seo.crawl.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class PageMetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(PageMetadataExtractor.class);

    public PageMetadata extract(String html) {
        if (html == null || html.isBlank()) {
            return PageMetadata.EMPTY;
        }
        return extract(Jsoup.parse(html));
    }

    public PageMetadata extract(Document document) {
        if (document == null) {
            return PageMetadata.EMPTY;
        }
        return new PageMetadata(
            field("title", () -> firstText(document, "title"), ""),
            field("metaDescription", () -> firstAttr(document, "meta[name=description]", "content"), ""),
            field("canonical", () -> firstAttr(document, "link[rel=canonical]", "href"), ""),
            field("h1", () -> firstText(document, "h1"), ""),
            field("h2Count", () -> document.select("h2").size(), 0),
            field("imgCount", () -> document.select("img").size(), 0),
            field("imgWithAlt", () -> document.select("img[alt]").size(), 0),
            field("wordCount", () -> wordCount(document), 0)
        );
    }

    static int wordCount(Document document) {
        Element body = document.body();
        if (body == null) {
            return 0;
        }
        String text = body.text().trim();
        if (text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String token : text.split("\\s+")) {
            if (!token.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    private String firstText(Document document, String cssQuery) {
        Element element = document.selectFirst(cssQuery);
        return element == null ? "" : element.text().trim();
    }

    private String firstAttr(Document document, String cssQuery, String attribute) {
        Element element = document.selectFirst(cssQuery);
        return element == null ? "" : element.attr(attribute);
    }

    private <T> T field(String name, Supplier<T> reader, T fallback) {
        try {
            T value = reader.get();
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            log.debug("Could not read {} from page, using default", name, e);
            return fallback;
        }
    }
}
