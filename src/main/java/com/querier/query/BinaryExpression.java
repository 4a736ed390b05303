package com.querier.query;

import java.util.Locale;

/**
 * Logical connective joining two filter expressions, e.g.
 * {@code pod = 'a' OR ip_version = 4}. The compiler folds both operands
 * into a single predicate under the same keyword.
 */
public class BinaryExpression implements Expression {
    private final String operator;
    private final Expression left;
    private final Expression right;

    /**
     * @param operator {@code and} or {@code or}, in any case
     */
    public BinaryExpression(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    /**
     * Connective as emitted into SQL ({@code AND} or {@code OR})
     */
    public String getKeyword() {
        return operator.trim().toUpperCase(Locale.ROOT);
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }
}
