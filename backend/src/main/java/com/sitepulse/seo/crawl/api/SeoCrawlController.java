package com.sitepulse.seo.crawl.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.seo.crawl.model.CrawlRequest;
import com.sitepulse.seo.crawl.service.CrawlOrchestratorService;
import com.sitepulse.seo.crawl.stream.NdjsonCrawlEventWriter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping("/api")
public class SeoCrawlController {
    private static final MediaType NDJSON = MediaType.parseMediaType(NdjsonCrawlEventWriter.MEDIA_TYPE);

    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ObjectMapper objectMapper;

    public SeoCrawlController(CrawlOrchestratorService crawlOrchestratorService, ObjectMapper objectMapper) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.objectMapper = objectMapper;
    }

    /**
     * Crawls {@code domain} and streams progress and per-page results as newline-delimited JSON.
     * Input problems are rejected with 400 before the stream starts.
     */
    @GetMapping("/analyze")
    public ResponseEntity<StreamingResponseBody> analyze(
        @RequestParam(name = "domain", required = false) String domain,
        @RequestParam(name = "maxPages", required = false) Integer maxPages
    ) {
        CrawlRequest request = crawlOrchestratorService.prepare(domain, maxPages);
        StreamingResponseBody body = out ->
            crawlOrchestratorService.run(request, new NdjsonCrawlEventWriter(out, objectMapper));
        return ResponseEntity.ok()
            .contentType(NDJSON)
            .header("Cache-Control", "no-cache")
            .header("X-Accel-Buffering", "no")
            .body(body);
    }
}
