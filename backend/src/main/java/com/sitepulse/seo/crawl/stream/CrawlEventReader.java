package com.sitepulse.seo.crawl.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.sitepulse.seo.crawl.model.CrawlEvent;
import com.sitepulse.seo.crawl.model.CrawlEventType;
import com.sitepulse.seo.crawl.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Consumer side of the newline-delimited event stream. Lines are parsed independently of how the
 * bytes were chunked on the wire; a line that is not a valid event is logged and dropped.
 */
public class CrawlEventReader {
    private static final Logger log = LoggerFactory.getLogger(CrawlEventReader.class);

    private final ObjectMapper objectMapper;
    private final ObjectReader pageReader;

    public CrawlEventReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.pageReader = objectMapper.readerFor(PageRecord.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Reads until end of stream, handing each valid event to {@code consumer}.
     *
     * @return number of events delivered
     */
    public int read(Reader source, Consumer<CrawlEvent> consumer) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        int delivered = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            CrawlEvent event = parseLine(line);
            if (event != null) {
                consumer.accept(event);
                delivered++;
            }
        }
        return delivered;
    }

    public List<CrawlEvent> readAll(InputStream in) throws IOException {
        List<CrawlEvent> events = new ArrayList<>();
        read(new InputStreamReader(in, StandardCharsets.UTF_8), events::add);
        return events;
    }

    public CrawlEvent parseLine(String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed crawl event: {}", abbreviate(line));
            return null;
        }
        if (root == null || !root.isObject()) {
            log.warn("Dropping non-object crawl event: {}", abbreviate(line));
            return null;
        }
        CrawlEventType type = CrawlEventType.fromWireName(root.path("type").asText(null));
        JsonNode value = root.get("value");
        if (type == null || value == null) {
            log.warn("Dropping crawl event without known type or value: {}", abbreviate(line));
            return null;
        }
        if (type == CrawlEventType.PROGRESS) {
            if (!value.canConvertToInt() || !value.isIntegralNumber()) {
                log.warn("Dropping progress event with non-integer value: {}", abbreviate(line));
                return null;
            }
            return CrawlEvent.progress(value.intValue());
        }
        try {
            PageRecord record = pageReader.readValue(value);
            return CrawlEvent.result(record);
        } catch (IOException e) {
            log.warn("Dropping result event with unreadable page record: {}", abbreviate(line));
            return null;
        }
    }

    private String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
