package com.sitepulse.seo.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for crawl URLs, used both for dedup and for the same-host filter.
 *
 * <p>A normalized URL is absolute http(s), on the crawl's base host, with no query string and no
 * fragment. Scheme and host are lower-case and default ports are dropped. A root URL is always {@code scheme://host/}; any other path carries no trailing slash.
 * Applying {@link #normalize} to its own output returns the same string.
 */
public final class UrlNormalizer {
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
    private static final Pattern SCHEME_WITH_AUTHORITY = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    private UrlNormalizer() {
    }

    /**
     * Normalizes {@code raw} as found on the page {@code pageUrl}.
     *
     * @return the normalized URL, or {@code null} when the link is rejected
     */
    public static String normalize(String raw, String pageUrl, String baseHost) {
        if (raw == null || baseHost == null) {
            return null;
        }
        String href = raw.trim();
        if (href.isEmpty() || href.startsWith("#")) {
            return null;
        }
        String lower = href.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:")) {
            return null;
        }
        URI page = safeUri(pageUrl);
        if (page == null || page.getScheme() == null || page.getRawAuthority() == null) {
            return null;
        }

        String resolved;
        if (SCHEME.matcher(href).find()) {
            resolved = href;
        } else if (href.startsWith("//")) {
            resolved = page.getScheme() + ":" + href;
        } else if (href.startsWith("/")) {
            resolved = page.getScheme() + "://" + baseHost + href;
        } else {
            resolved = resolveRelative(page, href);
        }
        if (resolved == null) {
            return null;
        }

        String stripped = stripQueryAndFragment(resolved);
        URI uri = safeUri(stripped);
        if (uri == null || !isHttp(uri) || uri.getHost() == null) {
            return null;
        }
        if (!hostKey(uri).equalsIgnoreCase(baseHost)) {
            return null;
        }
        return canonicalForm(uri);
    }

    /**
     * Turns user input (a bare host or an absolute URL) into the crawl's normalized seed URL.
     * Input without a scheme is treated as {@code https://}.
     *
     * @return the seed URL, or {@code null} when the input cannot name an http(s) host
     */
    public static String seedUrl(String domain) {
        if (domain == null || domain.isBlank()) {
            return null;
        }
        String value = domain.trim();
        if (!SCHEME_WITH_AUTHORITY.matcher(value).find()) {
            value = "https://" + value;
        }
        String stripped = stripQueryAndFragment(value);
        URI uri = safeUri(stripped);
        if (uri == null || !isHttp(uri) || uri.getHost() == null) {
            return null;
        }
        return normalize(stripped, stripped, hostKey(uri));
    }

    /**
     * Lower-cased host plus any non-default port, e.g. {@code example.com} or {@code localhost:8080}.
     */
    public static String hostKey(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || port == defaultPort(uri.getScheme())) {
            return host;
        }
        return host + ":" + port;
    }

    public static String hostKey(String url) {
        return hostKey(safeUri(url));
    }

    public static String stripQueryAndFragment(String url) {
        String out = url;
        int hash = out.indexOf('#');
        if (hash >= 0) {
            out = out.substring(0, hash);
        }
        int query = out.indexOf('?');
        if (query >= 0) {
            out = out.substring(0, query);
        }
        return out;
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim().replace(" ", "%20"));
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String resolveRelative(URI page, String href) {
        String path = page.getRawPath();
        URI base = page;
        if (path == null || path.isEmpty()) {
            base = safeUri(page.getScheme() + "://" + page.getRawAuthority() + "/");
        }
        String target = stripQueryAndFragment(href);
        if (target.isEmpty()) {
            return page.toString();
        }
        URI ref = safeUri(target);
        if (base == null || ref == null) {
            return null;
        }
        URI resolved;
        try {
            resolved = base.resolve(ref).normalize();
        } catch (IllegalArgumentException e) {
            return null;
        }
        return dropLeadingDotSegments(resolved);
    }

    // "../" above the root resolves to the root itself.
    private static String dropLeadingDotSegments(URI uri) {
        String value = uri.toString();
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return value;
        }
        String origin = uri.getScheme() + "://" + uri.getRawAuthority();
        if (!value.startsWith(origin)) {
            return value;
        }
        String rest = value.substring(origin.length());
        while (rest.startsWith("/../")) {
            rest = rest.substring(3);
        }
        if (rest.equals("/..")) {
            rest = "/";
        }
        return origin + rest;
    }

    private static String canonicalForm(URI uri) {
        String origin = uri.getScheme().toLowerCase(Locale.ROOT) + "://" + hostKey(uri);
        String path = uri.getRawPath();
        if (path == null || path.chars().allMatch(c -> c == '/')) {
            return origin + "/";
        }
        int end = path.length();
        while (path.charAt(end - 1) == '/') {
            end--;
        }
        return origin + path.substring(0, end);
    }

    private static boolean isHttp(URI uri) {
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static int defaultPort(String scheme) {
        if ("http".equalsIgnoreCase(scheme)) {
            return 80;
        }
        if ("https".equalsIgnoreCase(scheme)) {
            return 443;
        }
        return -1;
    }
}
