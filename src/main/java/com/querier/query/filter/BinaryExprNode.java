package com.querier.query.filter;

/**
 * Binary predicate (left op right). Used for AND/OR folding and for
 * filters written over functions. Regexp-style operators render in
 * function form, e.g. {@code match(left,right)}.
 */
public class BinaryExprNode implements FilterNode {
    static final String OR = "OR";
    static final String MATCH_ALL = "1=1";

    private final FilterNode left;
    private final String operator;
    private final FilterNode right;
    private final boolean functionStyle;

    public BinaryExprNode(FilterNode left, String operator, FilterNode right) {
        this(left, operator, right, false);
    }

    public BinaryExprNode(FilterNode left, String operator, FilterNode right, boolean functionStyle) {
        this.left = left;
        this.operator = operator;
        this.right = right;
        this.functionStyle = functionStyle;
    }

    public FilterNode getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public FilterNode getRight() {
        return right;
    }

    @Override
    public String toSql() {
        if (functionStyle) {
            return operator + "(" + left.toSql() + "," + right.toSql() + ")";
        }
        if (left.isEmpty() || right.isEmpty()) {
            return renderWithEmptyOperand();
        }
        return "(" + left.toSql() + " " + operator + " " + right.toSql() + ")";
    }

    /**
     * An empty operand places no constraint: it drops out of a conjunction
     * and makes a disjunction match every row
     */
    private String renderWithEmptyOperand() {
        if (OR.equalsIgnoreCase(operator)) {
            return MATCH_ALL;
        }
        return left.isEmpty() ? right.toSql() : left.toSql();
    }

    @Override
    public String toString() {
        return toSql();
    }
}
