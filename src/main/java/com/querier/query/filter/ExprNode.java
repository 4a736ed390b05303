package com.querier.query.filter;

/**
 * Leaf predicate holding literal SQL text
 */
public class ExprNode implements FilterNode {
    private final String value;

    public ExprNode(String value) {
        this.value = value;
    }

    public static ExprNode empty() {
        return new ExprNode("");
    }

    @Override
    public String toSql() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
