package com.querier.query;

/**
 * Represents a negated expression (NOT inner)
 */
public class NotExpression implements Expression {
    private final Expression inner;

    public NotExpression(Expression inner) {
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }
}
