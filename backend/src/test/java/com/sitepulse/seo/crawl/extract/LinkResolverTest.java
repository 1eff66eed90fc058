package com.sitepulse.seo.crawl.extract;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LinkResolverTest {
    private final LinkResolver resolver = new LinkResolver();

    @Test
    void collectsNormalizedSameHostLinks() {
        String html = """
            <html><body>
              <a href="/pricing">Pricing</a>
              <a href="/pricing/">Pricing again</a>
              <a href="/pricing?plan=pro#top">Pricing pro</a>
              <a href="team">Team</a>
              <a href="https://example.com/careers">Careers</a>
              <a href="https://twitter.com/example">Twitter</a>
              <a href="#main">Skip</a>
              <a href="javascript:void(0)">Menu</a>
              <a href="mailto:hi@example.com">Mail</a>
              <a href="http://[broken">Broken</a>
              <a>No href</a>
            </body></html>
            """;

        Set<String> links = resolver.discoverLinks(html, "https://example.com/company/about", "example.com");

        assertThat(links).containsExactlyInAnyOrder(
            "https://example.com/pricing",
            "https://example.com/company/team",
            "https://example.com/careers"
        );
    }

    @Test
    void emptyHtmlHasNoLinks() {
        assertThat(resolver.discoverLinks("", "https://example.com/", "example.com")).isEmpty();
        assertThat(resolver.discoverLinks((String) null, "https://example.com/", "example.com")).isEmpty();
    }
}
