package com.querier.query.filter;

/**
 * Named auxiliary subexpression emitted into the statement's WITH list
 */
public class WithClause {
    private final String expression;
    private final String alias;

    public WithClause(String expression, String alias) {
        this.expression = expression;
        this.alias = alias;
    }

    public String getExpression() {
        return expression;
    }

    public String getAlias() {
        return alias;
    }

    public String toSql() {
        return expression + " AS " + alias;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WithClause)) return false;
        WithClause other = (WithClause) o;
        return expression.equals(other.expression) && alias.equals(other.alias);
    }

    @Override
    public int hashCode() {
        return 31 * expression.hashCode() + alias.hashCode();
    }
}
