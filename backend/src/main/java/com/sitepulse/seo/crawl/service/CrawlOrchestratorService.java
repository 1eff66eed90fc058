package com.sitepulse.seo.crawl.service;

import com.sitepulse.seo.config.CrawlerProperties;
import com.sitepulse.seo.crawl.extract.LinkResolver;
import com.sitepulse.seo.crawl.extract.PageMetadataExtractor;
import com.sitepulse.seo.crawl.frontier.CrawlFrontier;
import com.sitepulse.seo.crawl.http.PoliteHttpClient;
import com.sitepulse.seo.crawl.model.CrawlEvent;
import com.sitepulse.seo.crawl.model.CrawlOutcome;
import com.sitepulse.seo.crawl.model.CrawlRequest;
import com.sitepulse.seo.crawl.model.CrawlSummary;
import com.sitepulse.seo.crawl.model.HttpFetchResult;
import com.sitepulse.seo.crawl.model.PageMetadata;
import com.sitepulse.seo.crawl.model.PageRecord;
import com.sitepulse.seo.crawl.stream.CrawlEventSink;
import com.sitepulse.seo.crawl.stream.CrawlStreamClosedException;
import com.sitepulse.seo.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drives one crawl from its seed to completion: fetch, extract, enqueue same-host links, emit events,
 * pause, repeat. Exactly one fetch is outstanding at a time. Each call to {@link #run} owns its own
 * frontier, so independent crawls can run in parallel on different threads.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    private final PoliteHttpClient httpClient;
    private final PageMetadataExtractor metadataExtractor;
    private final LinkResolver linkResolver;
    private final CrawlerProperties properties;

    public CrawlOrchestratorService(
        PoliteHttpClient httpClient,
        PageMetadataExtractor metadataExtractor,
        LinkResolver linkResolver,
        CrawlerProperties properties
    ) {
        this.httpClient = httpClient;
        this.metadataExtractor = metadataExtractor;
        this.linkResolver = linkResolver;
        this.properties = properties;
    }

    /**
     * Validates user input and fixes the crawl's seed, host and budget. Nothing is fetched.
     *
     * @throws InvalidSeedUrlException when {@code domain} is missing or does not name an http(s) host
     */
    public CrawlRequest prepare(String domain, Integer maxPages) {
        if (domain == null || domain.isBlank()) {
            throw new InvalidSeedUrlException("Domain parameter is required");
        }
        String seedUrl = UrlNormalizer.seedUrl(domain);
        if (seedUrl == null) {
            throw new InvalidSeedUrlException("Cannot crawl '" + domain.trim() + "': not an http(s) URL or host");
        }
        return new CrawlRequest(seedUrl, UrlNormalizer.hostKey(seedUrl), properties.resolveBudget(maxPages));
    }

    public CrawlSummary run(CrawlRequest request, CrawlEventSink sink) {
        Instant startedAt = Instant.now();
        CrawlFrontier frontier = new CrawlFrontier(request.budget());
        frontier.offer(request.seedUrl());
        List<PageRecord> results = new ArrayList<>();
        int failedPages = 0;
        CrawlOutcome outcome = CrawlOutcome.COMPLETED;
        log.info("Crawl of {} started (budget={})", request.seedUrl(), request.budget());

        try (sink) {
            while (frontier.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    outcome = CrawlOutcome.CANCELLED;
                    break;
                }
                String url = frontier.poll();
                if (!frontier.markVisited(url)) {
                    continue;
                }
                sink.send(CrawlEvent.progress(frontier.progressPercent()));

                PageVisit visit = visit(url, request);
                if (Thread.currentThread().isInterrupted()) {
                    // the fetch was abandoned, not answered
                    outcome = CrawlOutcome.CANCELLED;
                    break;
                }
                results.add(visit.record());
                if (visit.record().statusCode() == 0) {
                    failedPages++;
                }
                sink.send(CrawlEvent.result(visit.record()));

                for (String link : visit.links()) {
                    frontier.offer(link);
                }

                if (frontier.hasNext() && !pause()) {
                    outcome = CrawlOutcome.CANCELLED;
                    break;
                }
            }
            if (outcome == CrawlOutcome.COMPLETED && Thread.currentThread().isInterrupted()) {
                outcome = CrawlOutcome.CANCELLED;
            }
            if (outcome == CrawlOutcome.COMPLETED) {
                sink.send(CrawlEvent.progress(100));
            }
        } catch (CrawlStreamClosedException e) {
            outcome = CrawlOutcome.CANCELLED;
            log.info("Crawl of {} stopped, consumer went away: {}", request.seedUrl(), e.getMessage());
        }

        CrawlSummary summary = new CrawlSummary(
            request.seedUrl(),
            request.budget(),
            List.copyOf(results),
            failedPages,
            Duration.between(startedAt, Instant.now()),
            outcome
        );
        log.info(
            "Crawl of {} {}: pages={}, failed={}, elapsedMs={}",
            summary.seedUrl(),
            outcome == CrawlOutcome.COMPLETED ? "completed" : "cancelled",
            summary.pagesVisited(),
            summary.failedPages(),
            summary.elapsed().toMillis()
        );
        return summary;
    }

    private PageVisit visit(String url, CrawlRequest request) {
        try {
            HttpFetchResult fetch = httpClient.get(url);
            if (fetch.errorCode() != null) {
                log.debug(
                    "Fetch of {} failed after {}ms: {} {}",
                    url,
                    fetch.duration().toMillis(),
                    fetch.errorCode(),
                    fetch.errorMessage()
                );
            }
            if (!fetch.hasHtmlBody()) {
                return new PageVisit(PageRecord.of(url, fetch.statusCode(), PageMetadata.EMPTY), Set.of());
            }
            Document document = Jsoup.parse(fetch.body());
            PageMetadata metadata = metadataExtractor.extract(document);
            Set<String> links = linkResolver.discoverLinks(document, url, request.baseHost());
            log.debug(
                "Visited {} status={} links={} final={} in {}ms",
                url,
                fetch.statusCode(),
                links.size(),
                fetch.finalUrlOrRequested(),
                fetch.duration().toMillis()
            );
            return new PageVisit(PageRecord.of(url, fetch.statusCode(), metadata), links);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while processing {}", url, e);
            return new PageVisit(PageRecord.failed(url), Set.of());
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(properties.getPerHostDelayMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record PageVisit(PageRecord record, Set<String> links) {
    }
}
