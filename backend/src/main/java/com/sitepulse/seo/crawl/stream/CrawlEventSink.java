package com.sitepulse.seo.crawl.stream;

import com.sitepulse.seo.crawl.model.CrawlEvent;

/**
 * Ordered destination for crawl events. {@link #send} blocks until the event is handed to the
 * consumer, so a slow reader slows the crawl down.
 */
public interface CrawlEventSink extends AutoCloseable {

    /**
     * @throws CrawlStreamClosedException when the consumer is gone
     */
    void send(CrawlEvent event);

    @Override
    default void close() {
    }
}
