package com.querier.prometheus;

import java.time.Instant;

/**
 * Resolved remote-read filter and the instant it was resolved
 */
public class SubqueryCacheEntry {
    private final Instant time;
    private final String filter;

    public SubqueryCacheEntry(Instant time, String filter) {
        this.time = time;
        this.filter = filter;
    }

    public Instant getTime() {
        return time;
    }

    public String getFilter() {
        return filter;
    }
}
