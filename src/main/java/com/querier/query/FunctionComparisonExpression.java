package com.querier.query;

/**
 * Represents a comparison whose left side is a function (function op value)
 */
public class FunctionComparisonExpression implements Expression {
    private final FunctionExpression function;
    private final String operator;
    private final String value;

    public FunctionComparisonExpression(FunctionExpression function, String operator, String value) {
        this.function = function;
        this.operator = operator;
        this.value = value;
    }

    public FunctionExpression getFunction() {
        return function;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }
}
