package com.querier.tag;

/**
 * How a tag's predicate is built.
 *
 * PLAIN tags pass the operator straight into their template. SUBQUERY tags
 * test membership in a side lookup table, so negated operators invert the
 * positive subquery with {@code not(...)}. ENUM tags go through an enum
 * dictionary.
 */
public enum TagCategory {
    PLAIN,
    SUBQUERY,
    ENUM
}
