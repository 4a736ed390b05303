package com.querier.query.filter;

/**
 * A compiled predicate ready to be folded into a WHERE/HAVING clause
 */
public interface FilterNode {

    String toSql();

    default boolean isEmpty() {
        String sql = toSql();
        return sql == null || sql.isEmpty();
    }
}
