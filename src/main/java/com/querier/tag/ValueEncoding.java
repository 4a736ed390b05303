package com.querier.tag;

/**
 * Literal encoding a tag needs before its template is filled
 */
public enum ValueEncoding {
    /** values pass through as written */
    DEFAULT,
    /** IPv4/IPv6 and CIDR literals compared as hex */
    IP,
    /** integer id list, one predicate per id */
    ID,
    /** {@code 4} maps to the is_ipv4 flag, anything else to 0 */
    IP_VERSION,
    /** boolean flag stored as a sentinel comparison */
    BOOLEAN_TRI_STATE,
    /** membership in an array column */
    ARRAY
}
