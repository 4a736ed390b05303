package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits and joins literal value lists such as {@code ('a','b')} or {@code (1,2)}.
 * Commas inside single-quoted literals do not split.
 */
public final class ValueList {

    private ValueList() {
        throw new UnsupportedOperationException("ValueList is a utility class and cannot be instantiated");
    }

    /**
     * Split a literal or parenthesized list into trimmed elements, quotes kept
     */
    public static List<String> split(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) {
            return values;
        }
        String text = stripParentheses(raw.trim());
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' && (i == 0 || text.charAt(i - 1) != '\\')) {
                quoted = !quoted;
            }
            if (c == ',' && !quoted) {
                addIfPresent(values, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(values, current);
        return values;
    }

    /**
     * Split a value list that must hold at least one element
     *
     * @throws FilterCompilationException with {@code MALFORMED_LITERAL} for {@code ()} or a blank value
     */
    public static List<String> requireValues(String raw) {
        List<String> values = split(raw);
        if (values.isEmpty()) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "empty value list: " + raw);
        }
        return values;
    }

    /**
     * Remove one pair of surrounding single quotes
     */
    public static String unquote(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("'") && trimmed.endsWith("'")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static String quote(String value) {
        return "'" + value + "'";
    }

    /**
     * Join encoded values, parenthesized when the operator takes a list
     */
    public static String join(List<String> values, Operator operator) {
        String joined = String.join(",", values);
        if (operator.isList()) {
            return "(" + joined + ")";
        }
        return joined;
    }

    private static String stripParentheses(String text) {
        if (text.length() >= 2 && text.startsWith("(") && text.endsWith(")")) {
            return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private static void addIfPresent(List<String> values, StringBuilder current) {
        String value = current.toString().trim();
        if (!value.isEmpty()) {
            values.add(value);
        }
    }
}
