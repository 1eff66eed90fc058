package com.sitepulse.seo.crawl.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.seo.crawl.model.CrawlEvent;
import com.sitepulse.seo.crawl.model.PageMetadata;
import com.sitepulse.seo.crawl.model.PageRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlEventReaderTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CrawlEventReader reader = new CrawlEventReader(objectMapper);

    @Test
    void readsWhatTheWriterProduces() throws Exception {
        PageRecord record = PageRecord.of(
            "https://example.com/about",
            200,
            new PageMetadata("About", "", "", "About us", 1, 0, 0, 57)
        );
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NdjsonCrawlEventWriter writer = new NdjsonCrawlEventWriter(out, objectMapper);
        writer.send(CrawlEvent.progress(50));
        writer.send(CrawlEvent.result(record));
        writer.send(CrawlEvent.progress(100));

        List<CrawlEvent> events = reader.readAll(new ByteArrayInputStream(out.toByteArray()));

        assertThat(events).hasSize(3);
        assertThat(events.get(0).progressValue()).isEqualTo(50);
        assertThat(events.get(1).pageRecord()).isEqualTo(record);
        assertThat(events.get(2).progressValue()).isEqualTo(100);
    }

    @Test
    void dropsMalformedLinesAndKeepsReading() throws Exception {
        String stream = String.join("\n",
            "{\"type\":\"progress\",\"value\":10}",
            "{\"type\":\"progress\",\"val",
            "",
            "[1,2,3]",
            "{\"type\":\"heartbeat\",\"value\":1}",
            "{\"type\":\"progress\",\"value\":\"high\"}",
            "{\"type\":\"result\",\"value\":{\"url\":\"https://example.com/\",\"statusCode\":0,\"extra\":true}}",
            "{\"type\":\"progress\",\"value\":100}"
        );
        List<CrawlEvent> events = new ArrayList<>();

        int delivered = reader.read(new StringReader(stream), events::add);

        assertThat(delivered).isEqualTo(3);
        assertThat(events.get(0).progressValue()).isEqualTo(10);
        assertThat(events.get(1).pageRecord().url()).isEqualTo("https://example.com/");
        assertThat(events.get(1).pageRecord().statusCode()).isZero();
        assertThat(events.get(2).progressValue()).isEqualTo(100);
    }

    @Test
    void handlesEventsSplitAcrossReads() throws Exception {
        byte[] payload = "{\"type\":\"progress\",\"value\":5}\n{\"type\":\"progress\",\"value\":100}\n"
            .getBytes(StandardCharsets.UTF_8);
        ByteArrayInputStream trickle = new ByteArrayInputStream(payload) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                return super.read(b, off, Math.min(len, 7));
            }
        };

        List<CrawlEvent> events = reader.readAll(trickle);

        assertThat(events).extracting(CrawlEvent::progressValue).containsExactly(5, 100);
    }
}
