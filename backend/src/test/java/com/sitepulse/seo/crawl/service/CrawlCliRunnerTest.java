package com.sitepulse.seo.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.seo.config.CrawlerProperties;
import com.sitepulse.seo.crawl.extract.LinkResolver;
import com.sitepulse.seo.crawl.extract.PageMetadataExtractor;
import com.sitepulse.seo.crawl.http.PoliteHttpClient;
import com.sitepulse.seo.crawl.model.CrawlEvent;
import com.sitepulse.seo.crawl.model.CrawlOutcome;
import com.sitepulse.seo.crawl.model.CrawlSummary;
import com.sitepulse.seo.crawl.stream.CrawlEventReader;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlCliRunnerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
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
    void writesEventStreamForConfiguredDomain() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html")
            .setBody("<html><head><title>CLI</title></head><body><a href=\"/next\">next</a></body></html>"));
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.getCli().setRun(true);
        properties.getCli().setDomain(server.url("/").toString());
        properties.getCli().setMaxPages(1);
        CrawlCliRunner runner = runner(properties);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CrawlSummary summary = runner.crawl(out);

        assertThat(summary.outcome()).isEqualTo(CrawlOutcome.COMPLETED);
        assertThat(summary.budget()).isEqualTo(1);
        List<CrawlEvent> events = new CrawlEventReader(objectMapper).readAll(new ByteArrayInputStream(out.toByteArray()));
        assertThat(events).hasSize(3);
        assertThat(events.get(1).pageRecord().title()).isEqualTo("CLI");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void doesNothingWhenCliModeIsOff() throws Exception {
        server = new MockWebServer();
        server.start();
        CrawlerProperties properties = new CrawlerProperties();
        properties.getCli().setDomain(server.url("/").toString());

        runner(properties).run(Mockito.mock(ApplicationArguments.class));

        assertThat(server.getRequestCount()).isZero();
    }

    private CrawlCliRunner runner(CrawlerProperties properties) {
        executor = Executors.newFixedThreadPool(1);
        CrawlOrchestratorService service = new CrawlOrchestratorService(
            new PoliteHttpClient(properties, executor),
            new PageMetadataExtractor(),
            new LinkResolver(),
            properties
        );
        return new CrawlCliRunner(
            properties,
            service,
            objectMapper,
            Mockito.mock(ConfigurableApplicationContext.class)
        );
    }
}
