package com.querier.query;

import com.querier.query.filter.TimeWindow;
import com.querier.query.filter.WithClause;

import java.util.Collections;
import java.util.List;

/**
 * Executable SQL plus the time window folded out of its filters
 */
public class CompiledStatement {
    private final String sql;
    private final TimeWindow timeWindow;
    private final List<WithClause> withs;

    public CompiledStatement(String sql, TimeWindow timeWindow, List<WithClause> withs) {
        this.sql = sql;
        this.timeWindow = timeWindow;
        this.withs = Collections.unmodifiableList(withs);
    }

    public String getSql() {
        return sql;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public List<WithClause> getWiths() {
        return withs;
    }

    @Override
    public String toString() {
        return sql;
    }
}
