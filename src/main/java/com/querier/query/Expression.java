package com.querier.query;

/**
 * Marker for nodes of the parsed WHERE/HAVING expression tree
 */
public interface Expression {
}
