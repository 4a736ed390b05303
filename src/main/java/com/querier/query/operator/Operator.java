package com.querier.query.operator;

/**
 * Comparison operators accepted in filters and their ClickHouse dialect tokens.
 *
 * {@code like} becomes case-insensitive {@code ilike}; {@code regexp} becomes
 * the {@code match} function.
 */
public enum Operator {
    EQ("=", "="),
    NE("!=", "!="),
    LT("<", "<"),
    LE("<=", "<="),
    GT(">", ">"),
    GE(">=", ">="),
    IN("in", "in"),
    NOT_IN("not in", "not in"),
    LIKE("like", "ilike"),
    NOT_LIKE("not like", "not ilike"),
    REGEXP("regexp", "match"),
    NOT_REGEXP("not regexp", "not match");

    private final String token;
    private final String dialect;

    Operator(String token, String dialect) {
        this.token = token;
        this.dialect = dialect;
    }

    /**
     * Operator as written in the query language (lower case)
     */
    public String getToken() {
        return token;
    }

    /**
     * Operator as emitted into ClickHouse SQL
     */
    public String getDialect() {
        return dialect;
    }

    public boolean isRegexp() {
        return this == REGEXP || this == NOT_REGEXP;
    }

    public boolean isLike() {
        return this == LIKE || this == NOT_LIKE;
    }

    public boolean isList() {
        return this == IN || this == NOT_IN;
    }

    public boolean isRange() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    public boolean isNegated() {
        return this == NE || this == NOT_IN || this == NOT_LIKE || this == NOT_REGEXP;
    }

    /**
     * The non-negated counterpart; operators without one return themselves
     */
    public Operator positive() {
        switch (this) {
            case NE:
                return EQ;
            case NOT_IN:
                return IN;
            case NOT_LIKE:
                return LIKE;
            case NOT_REGEXP:
                return REGEXP;
            default:
                return this;
        }
    }

    @Override
    public String toString() {
        return dialect;
    }
}
