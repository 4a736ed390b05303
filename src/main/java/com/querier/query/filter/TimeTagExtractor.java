package com.querier.query.filter;

import com.querier.query.ComparisonExpression;
import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.regex.Pattern;

/**
 * Folds comparisons on the reserved {@code time} tag into the time window.
 *
 * The value is an integer or a small arithmetic expression such as
 * {@code 1700000000 - 3600*24}, evaluated in double precision. The comparison
 * is still emitted verbatim as a predicate.
 */
public final class TimeTagExtractor {

    public static final String TIME_TAG = "time";

    private static final Pattern PLAIN_INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern ARITHMETIC = Pattern.compile("[0-9+\\-*/().\\s]+");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![\\d.])(\\d+)(?![\\d.])");
    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private TimeTagExtractor() {
        throw new UnsupportedOperationException("TimeTagExtractor is a utility class and cannot be instantiated");
    }

    public static boolean isTimeTag(String tagName) {
        return TIME_TAG.equals(tagName);
    }

    /**
     * @param operator the comparison's normalized operator
     * @throws FilterCompilationException with {@code MALFORMED_LITERAL} if the value does not evaluate
     */
    public static FilterNode extract(ComparisonExpression expression, Operator operator, TimeWindow window) {
        long time = evaluate(expression.getValue());
        if (operator == Operator.GE) {
            window.addTimeStart(time);
        } else if (operator == Operator.LE) {
            window.addTimeEnd(time);
        }
        return new ExprNode(expression.toSql());
    }

    static long evaluate(String value) {
        String text = value == null ? "" : value.trim();
        if (PLAIN_INTEGER.matcher(text).matches()) {
            return Long.parseLong(text);
        }
        if (text.isEmpty() || !ARITHMETIC.matcher(text).matches()) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid time expression: " + value);
        }
        Object result;
        try {
            String doubles = INTEGER_LITERAL.matcher(text).replaceAll("$1.0");
            result = PARSER.parseExpression(doubles)
                    .getValue(SimpleEvaluationContext.forReadOnlyDataBinding().build());
        } catch (ExpressionException e) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid time expression: " + value, e);
        }
        if (!(result instanceof Number)) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid time expression: " + value);
        }
        double number = ((Number) result).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid time expression: " + value);
        }
        return (long) number;
    }
}
