package com.sitepulse.seo.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One unit of the crawl event stream: {@code {"type":"progress","value":42}} or
 * {@code {"type":"result","value":{...page record...}}}.
 */
public record CrawlEvent(CrawlEventType type, Object value) {

    public static CrawlEvent progress(int percent) {
        return new CrawlEvent(CrawlEventType.PROGRESS, Math.max(0, Math.min(100, percent)));
    }

    public static CrawlEvent result(PageRecord record) {
        return new CrawlEvent(CrawlEventType.RESULT, record);
    }

    @JsonIgnore
    public boolean isProgress() {
        return type == CrawlEventType.PROGRESS;
    }

    @JsonIgnore
    public boolean isResult() {
        return type == CrawlEventType.RESULT;
    }

    public int progressValue() {
        if (!isProgress()) {
            throw new IllegalStateException("not a progress event: " + type);
        }
        return (Integer) value;
    }

    public PageRecord pageRecord() {
        if (!isResult()) {
            throw new IllegalStateException("not a result event: " + type);
        }
        return (PageRecord) value;
    }
}
