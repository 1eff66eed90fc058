package com.sitepulse.seo.crawl.frontier;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Breadth-first queue of pending URLs plus the visited set for one crawl. The sum of pending and
 * visited URLs never exceeds the budget, and a URL is accepted at most once over the crawl's lifetime.
 * Not thread-safe; a frontier belongs to exactly one crawl loop.
 */
public class CrawlFrontier {
    private final int budget;
    private final Deque<String> pending = new ArrayDeque<>();
    private final Set<String> queued = new HashSet<>();
    private final Set<String> visited = new HashSet<>();

    public CrawlFrontier(int budget) {
        if (budget < 1) {
            throw new IllegalArgumentException("budget must be at least 1, was " + budget);
        }
        this.budget = budget;
    }

    /**
     * Appends {@code url} unless it was already seen or the budget is used up.
     *
     * @return whether the URL was enqueued
     */
    public boolean offer(String url) {
        if (url == null || visited.contains(url) || queued.contains(url)) {
            return false;
        }
        if (pending.size() + visited.size() >= budget) {
            return false;
        }
        pending.addLast(url);
        queued.add(url);
        return true;
    }

    public boolean hasNext() {
        return !pending.isEmpty() && visited.size() < budget;
    }

    /**
     * Removes and returns the oldest pending URL, or {@code null} when none is left.
     */
    public String poll() {
        String next = pending.pollFirst();
        if (next != null) {
            queued.remove(next);
        }
        return next;
    }

    /**
     * @return false when the URL had already been visited
     */
    public boolean markVisited(String url) {
        return visited.add(url);
    }

    public boolean isVisited(String url) {
        return visited.contains(url);
    }

    public int visitedCount() {
        return visited.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public int budget() {
        return budget;
    }

    public int progressPercent() {
        return (int) Math.round(visited.size() * 100.0 / budget);
    }
}
