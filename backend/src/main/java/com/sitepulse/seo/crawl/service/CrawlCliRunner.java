package com.sitepulse.seo.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.seo.config.CrawlerProperties;
import com.sitepulse.seo.crawl.model.CrawlRequest;
import com.sitepulse.seo.crawl.model.CrawlSummary;
import com.sitepulse.seo.crawl.stream.NdjsonCrawlEventWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.OutputStream;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        CrawlSummary summary = crawl(System.out);
        log.info(
            "CLI crawl of {} finished with {}: pages={}, failed={}",
            summary.seedUrl(),
            summary.outcome(),
            summary.pagesVisited(),
            summary.failedPages()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    CrawlSummary crawl(OutputStream out) {
        int maxPages = properties.getCli().getMaxPages();
        CrawlRequest request = crawlOrchestratorService.prepare(
            properties.getCli().getDomain(),
            maxPages > 0 ? maxPages : null
        );
        return crawlOrchestratorService.run(request, new NdjsonCrawlEventWriter(out, objectMapper));
    }
}
