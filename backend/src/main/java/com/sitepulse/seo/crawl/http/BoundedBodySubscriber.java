package com.sitepulse.seo.crawl.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Collects a response body up to {@code limit} bytes. Once the limit is crossed the subscription is
 * cancelled, so an oversized body is never held in memory beyond the limit plus one chunk.
 */
final class BoundedBodySubscriber implements HttpResponse.BodySubscriber<BoundedBodySubscriber.Body> {
    private final long limit;
    private final CompletableFuture<Body> result = new CompletableFuture<>();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Flow.Subscription subscription;
    private boolean done;

    BoundedBodySubscriber(long limit) {
        this.limit = limit;
    }

    @Override
    public CompletionStage<Body> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        if (done) {
            return;
        }
        for (ByteBuffer item : items) {
            int size = item.remaining();
            if (buffer.size() + (long) size > limit) {
                done = true;
                subscription.cancel();
                result.complete(new Body(null, true));
                return;
            }
            byte[] chunk = new byte[size];
            item.get(chunk);
            buffer.write(chunk, 0, size);
        }
    }

    @Override
    public void onError(Throwable error) {
        if (!done) {
            done = true;
            result.completeExceptionally(error);
        }
    }

    @Override
    public void onComplete() {
        if (!done) {
            done = true;
            result.complete(new Body(buffer.toByteArray(), false));
        }
    }

    /** Bytes read, or {@code tooLarge} with no bytes when the limit was crossed. */
    record Body(byte[] bytes, boolean tooLarge) {
    }
}
