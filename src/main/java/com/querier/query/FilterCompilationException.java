package com.querier.query;

/**
 * Exception thrown when a filter cannot be compiled
 * Carries the error kind plus the tag, table and operator that were being
 * translated so callers can render a user-facing message
 */
public class FilterCompilationException extends RuntimeException {

    /**
     * Failure categories surfaced by the compiler
     */
    public enum ErrorKind {
        UNSUPPORTED_OPERATOR,
        MALFORMED_LITERAL,
        UNKNOWN_REGISTRY_ENTRY,
        BACKING_STORE_FAILURE
    }

    private final ErrorKind kind;
    private final String tag;
    private final String table;
    private final String operator;

    public FilterCompilationException(ErrorKind kind, String message) {
        this(kind, message, null, null, null, null);
    }

    public FilterCompilationException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, null, null, cause);
    }

    public FilterCompilationException(ErrorKind kind, String message, String tag, String table, String operator) {
        this(kind, message, tag, table, operator, null);
    }

    public FilterCompilationException(ErrorKind kind, String message, String tag, String table,
                                      String operator, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.tag = tag;
        this.table = table;
        this.operator = operator;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getTag() {
        return tag;
    }

    public String getTable() {
        return table;
    }

    public String getOperator() {
        return operator;
    }

    /**
     * Returns a copy of this exception enriched with translation context.
     * Context already present is kept.
     */
    public FilterCompilationException withContext(String tag, String table, String operator) {
        FilterCompilationException enriched = new FilterCompilationException(
                kind,
                super.getMessage(),
                this.tag != null ? this.tag : tag,
                this.table != null ? this.table : table,
                this.operator != null ? this.operator : operator,
                getCause());
        enriched.setStackTrace(getStackTrace());
        return enriched;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (tag != null) {
            sb.append(" [Tag: ").append(tag).append("]");
        }
        if (table != null) {
            sb.append(" [Table: ").append(table).append("]");
        }
        if (operator != null) {
            sb.append(" [Operator: ").append(operator).append("]");
        }
        return sb.toString();
    }
}
