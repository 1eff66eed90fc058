package com.sitepulse.seo.crawl.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.sitepulse.seo.config.CrawlerProperties;
import com.sitepulse.seo.crawl.model.HttpFetchResult;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PoliteHttpClientMaxBytesTest {
  private MockWebServer server;
  private ExecutorService executor;

  @AfterEach
  void tearDown() throws Exception {
    if (server != null) {
      server.shutdown();
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void returnsBodyTooLargeWhenHtmlExceedsMaxBytes() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html")
        .setBody("<p>" + "a".repeat(5000) + "</p>"));
    server.start();

    CrawlerProperties properties = new CrawlerProperties();
    properties.setRequestTimeoutSeconds(5);
    properties.setMaxBodyBytes(1024);

    executor = Executors.newFixedThreadPool(1);
    PoliteHttpClient client = new PoliteHttpClient(properties, executor);

    HttpFetchResult result = client.get(server.url("/big").toString());

    assertThat(result.errorCode()).isEqualTo("body_too_large");
    assertThat(result.statusCode()).isEqualTo(200);
    assertThat(result.body()).isNull();
    assertThat(result.hasHtmlBody()).isFalse();
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void keepsHtmlBodyExactlyAtTheLimit() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html")
        .setBody("<p>" + "a".repeat(1017) + "</p>"));
    server.start();

    HttpFetchResult result = clientWithLimit(1024).get(server.url("/fits").toString());

    assertThat(result.errorCode()).isNull();
    assertThat(result.body()).hasSize(1024);
    assertThat(result.hasHtmlBody()).isTrue();
  }

  @Test
  void stopsReadingChunkedBodyOnceLimitIsCrossed() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html; charset=utf-8")
        .setChunkedBody("<p>" + "b".repeat(200_000) + "</p>", 512));
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "text/html")
        .setBody("<p>next</p>"));
    server.start();
    PoliteHttpClient client = clientWithLimit(2048);

    HttpFetchResult big = client.get(server.url("/chunked").toString());
    HttpFetchResult next = client.get(server.url("/next").toString());

    assertThat(big.errorCode()).isEqualTo("body_too_large");
    assertThat(big.statusCode()).isEqualTo(200);
    assertThat(big.body()).isNull();
    assertThat(next.body()).contains("next");
  }

  private PoliteHttpClient clientWithLimit(int maxBodyBytes) {
    CrawlerProperties properties = new CrawlerProperties();
    properties.setRequestTimeoutSeconds(5);
    properties.setMaxBodyBytes(maxBodyBytes);
    executor = Executors.newFixedThreadPool(1);
    return new PoliteHttpClient(properties, executor);
  }
}
