package com.sitepulse.seo.crawl.extract;

import com.sitepulse.seo.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the same-host links of a page in normalized form. Links that cannot be resolved are
 * skipped individually.
 */
@Component
public class LinkResolver {

    public Set<String> discoverLinks(String html, String pageUrl, String baseHost) {
        if (html == null || html.isBlank()) {
            return Set.of();
        }
        return discoverLinks(Jsoup.parse(html), pageUrl, baseHost);
    }

    public Set<String> discoverLinks(Document document, String pageUrl, String baseHost) {
        Set<String> links = new LinkedHashSet<>();
        if (document == null) {
            return links;
        }
        for (Element anchor : document.select("a[href]")) {
            String normalized = UrlNormalizer.normalize(anchor.attr("href"), pageUrl, baseHost);
            if (normalized != null) {
                links.add(normalized);
            }
        }
        return links;
    }
}
