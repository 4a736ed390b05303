package com.querier.query.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * WHERE clause under construction: the filter set, the WITH expressions
 * generated along the way, and the time window taken from {@code time}
 * comparisons
 */
public class Where {
    private final Filters filters = new Filters();
    private final List<WithClause> withs = new ArrayList<>();
    private final TimeWindow timeWindow;

    public Where() {
        this(new TimeWindow());
    }

    public Where(TimeWindow timeWindow) {
        this.timeWindow = timeWindow;
    }

    public void addFilter(FilterNode node) {
        filters.add(node);
    }

    public void addWiths(List<WithClause> clauses) {
        for (WithClause clause : clauses) {
            if (!withs.contains(clause)) {
                withs.add(clause);
            }
        }
    }

    public Filters getFilters() {
        return filters;
    }

    public List<WithClause> getWiths() {
        return Collections.unmodifiableList(withs);
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public boolean isEmpty() {
        return filters.isNull();
    }

    protected String keyword() {
        return "WHERE";
    }

    /**
     * Finished clause text, or empty when no filter was added
     */
    public Optional<String> toClause() {
        if (filters.isNull()) {
            return Optional.empty();
        }
        return Optional.of(keyword() + " " + filters.toSql());
    }
}
