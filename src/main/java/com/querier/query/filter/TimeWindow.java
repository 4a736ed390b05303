package com.querier.query.filter;

import java.util.OptionalLong;

/**
 * Start/end bounds folded out of {@code time} comparisons, used downstream
 * for partition pruning. Last write wins per bound.
 */
public class TimeWindow {
    private Long start;
    private Long end;

    public void addTimeStart(long start) {
        this.start = start;
    }

    public void addTimeEnd(long end) {
        this.end = end;
    }

    public OptionalLong getStart() {
        return start == null ? OptionalLong.empty() : OptionalLong.of(start);
    }

    public OptionalLong getEnd() {
        return end == null ? OptionalLong.empty() : OptionalLong.of(end);
    }

    @Override
    public String toString() {
        return "TimeWindow{start=" + start + ", end=" + end + "}";
    }
}
