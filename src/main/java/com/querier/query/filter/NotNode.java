package com.querier.query.filter;

/**
 * Negation of a compiled predicate, rendered as {@code not(inner)}.
 * Renders lazily so deferred inner predicates show their resolved form.
 */
public class NotNode implements FilterNode {
    private final FilterNode inner;

    public NotNode(FilterNode inner) {
        this.inner = inner;
    }

    public FilterNode getInner() {
        return inner;
    }

    @Override
    public String toSql() {
        if (inner.isEmpty()) {
            return "";
        }
        return "not(" + inner.toSql() + ")";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
