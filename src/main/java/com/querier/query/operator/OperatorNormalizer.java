package com.querier.query.operator;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps source comparison tokens to dialect operators and rewrites
 * {@code *} wildcards for the like family
 */
public final class OperatorNormalizer {

    private static final Map<String, Operator> BY_TOKEN = new HashMap<>();

    static {
        for (Operator operator : Operator.values()) {
            BY_TOKEN.put(operator.getToken(), operator);
        }
    }

    private OperatorNormalizer() {
        throw new UnsupportedOperationException("OperatorNormalizer is a utility class and cannot be instantiated");
    }

    /**
     * Resolve a raw comparison token, case-insensitively
     *
     * @param token the operator as written, e.g. {@code NOT LIKE}
     * @return the matching operator
     * @throws FilterCompilationException with {@code UNSUPPORTED_OPERATOR} for unknown tokens
     */
    public static Operator normalize(String token) {
        if (token == null) {
            throw new FilterCompilationException(ErrorKind.UNSUPPORTED_OPERATOR, "operator: null not support");
        }
        String key = token.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        Operator operator = BY_TOKEN.get(key);
        if (operator == null) {
            throw new FilterCompilationException(ErrorKind.UNSUPPORTED_OPERATOR,
                    String.format("operator: %s not support", token));
        }
        return operator;
    }

    /**
     * Rewrite {@code *} to {@code %} for like operators; other values are returned as is
     */
    public static String rewriteWildcard(Operator operator, String value) {
        if (value == null || !operator.isLike()) {
            return value;
        }
        return value.replace('*', '%');
    }
}
