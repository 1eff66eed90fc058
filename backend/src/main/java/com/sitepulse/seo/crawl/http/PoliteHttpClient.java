package com.sitepulse.seo.crawl.http;

import com.sitepulse.seo.config.CrawlerProperties;
import com.sitepulse.seo.crawl.model.HttpFetchResult;
import com.sitepulse.seo.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-request HTTP GET with a fixed user agent and a hard per-request deadline. Failures never
 * throw: they come back as an {@link HttpFetchResult} with {@code statusCode == 0} and an error code.
 * Bodies are only read for HTML responses.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final CrawlerProperties properties;
    private final HttpClient client;

    public PoliteHttpClient(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url) {
        Instant startedAt = Instant.now();
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeUserAgent = CrawlerProperties.normalizeUserAgent(properties.getUserAgent());
        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .header("User-Agent", safeUserAgent)
                .header("Accept", HTML_ACCEPT)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }

        CompletableFuture<HttpResponse<BoundedBodySubscriber.Body>> pending =
            client.sendAsync(request, htmlOnlyBodyHandler());
        try {
            HttpResponse<BoundedBodySubscriber.Body> response = pending.get(timeoutSeconds, TimeUnit.SECONDS);
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            BoundedBodySubscriber.Body responseBody = response.body();
            if (responseBody != null && responseBody.tooLarge()) {
                log.debug("Dropping body from {}: more than {} bytes", url, properties.getMaxBodyBytes());
                return new HttpFetchResult(
                    url,
                    response.uri(),
                    response.statusCode(),
                    null,
                    contentType,
                    Duration.between(startedAt, Instant.now()),
                    "body_too_large",
                    "body exceeds " + properties.getMaxBodyBytes() + " bytes"
                );
            }
            String text = responseBody == null ? null : new String(responseBody.bytes(), charsetOf(contentType));
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                text,
                contentType,
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (TimeoutException e) {
            pending.cancel(true);
            return errorResult(url, startedAt, "timeout", "no response within " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, "timeout", cause.getMessage());
            }
            if (cause instanceof IOException) {
                return errorResult(url, startedAt, "io_error", describe(cause));
            }
            return errorResult(url, startedAt, "http_error", describe(cause));
        }
    }

    private HttpResponse.BodyHandler<BoundedBodySubscriber.Body> htmlOnlyBodyHandler() {
        long limit = properties.getMaxBodyBytes();
        return responseInfo -> {
            String contentType = responseInfo.headers().firstValue("Content-Type").orElse(null);
            if (HttpFetchResult.isHtmlContentType(contentType)) {
                return new BoundedBodySubscriber(limit);
            }
            return HttpResponse.BodySubscribers.replacing((BoundedBodySubscriber.Body) null);
        };
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
