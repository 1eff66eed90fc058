package com.sitepulse.seo.crawl.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.seo.crawl.model.CrawlEvent;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes each event as one line of JSON and flushes it, so every event reaches the consumer as a
 * self-contained newline-terminated frame.
 */
public class NdjsonCrawlEventWriter implements CrawlEventSink {
    public static final String MEDIA_TYPE = "application/x-ndjson";

    private final OutputStream out;
    private final ObjectMapper objectMapper;
    private boolean closed;

    public NdjsonCrawlEventWriter(OutputStream out, ObjectMapper objectMapper) {
        this.out = out;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(CrawlEvent event) {
        if (closed) {
            throw new CrawlStreamClosedException("event stream already closed", null);
        }
        byte[] line;
        try {
            line = objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode crawl event " + event.type(), e);
        }
        try {
            out.write(line);
            out.write('\n');
            out.flush();
        } catch (IOException e) {
            closed = true;
            throw new CrawlStreamClosedException("consumer stopped reading: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.flush();
        } catch (IOException ignored) {
            // Consumer already gone; nothing left to deliver.
        }
    }
}
