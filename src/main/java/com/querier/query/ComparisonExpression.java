package com.querier.query;

/**
 * Represents a comparison expression (tag op value)
 *
 * The value keeps its literal form as written in the query, quotes and
 * list parentheses included, e.g. {@code 'web'} or {@code (1,2,3)}.
 */
public class ComparisonExpression implements Expression {
    private final String field;
    private final String operator;
    private final String value;

    public ComparisonExpression(String field, String operator, String value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    /**
     * Verbatim filter text, used as the remote-read cache key
     */
    public String toSql() {
        return field + " " + operator + " " + value;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
