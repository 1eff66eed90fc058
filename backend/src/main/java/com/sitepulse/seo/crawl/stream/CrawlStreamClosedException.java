package com.sitepulse.seo.crawl.stream;

public class CrawlStreamClosedException extends RuntimeException {
    public CrawlStreamClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
