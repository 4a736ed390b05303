package com.querier.query.encoder;

import com.querier.query.operator.Operator;
import com.querier.tag.WhereTranslator;

/**
 * Compiles boolean flags stored as a sentinel comparison, e.g. {@code is_internet}.
 * A value set holding both truth values matches everything.
 */
public final class BooleanTriStateEncoder {

    public static final String TAUTOLOGY = "1=1";

    private BooleanTriStateEncoder() {
        throw new UnsupportedOperationException("BooleanTriStateEncoder is a utility class and cannot be instantiated");
    }

    /**
     * @param translator template filled with {@code =} when the flag is true and {@code !=} when false
     */
    public static String encode(Operator operator, String value, WhereTranslator translator) {
        boolean hasTrue = false;
        boolean hasFalse = false;
        for (String element : ValueList.requireValues(value)) {
            if ("1".equals(ValueList.unquote(element))) {
                hasTrue = true;
            } else {
                hasFalse = true;
            }
        }
        if (hasTrue && hasFalse) {
            return TAUTOLOGY;
        }
        boolean positive = operator == Operator.EQ || operator == Operator.IN;
        boolean matchTrue = hasTrue == positive;
        return translator.translate(matchTrue ? "=" : "!=", null);
    }
}
