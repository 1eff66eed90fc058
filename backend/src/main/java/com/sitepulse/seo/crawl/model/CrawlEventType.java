package com.sitepulse.seo.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CrawlEventType {
    PROGRESS,
    RESULT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CrawlEventType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (CrawlEventType type : values()) {
            if (type.wireName().equals(value)) {
                return type;
            }
        }
        return null;
    }
}
