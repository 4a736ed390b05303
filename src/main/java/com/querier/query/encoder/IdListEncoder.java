package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import com.querier.tag.WhereTranslator;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles integer ID lists into an OR of per-id predicates
 */
public final class IdListEncoder {

    private IdListEncoder() {
        throw new UnsupportedOperationException("IdListEncoder is a utility class and cannot be instantiated");
    }

    public static String encode(Operator operator, String value, WhereTranslator translator) {
        String idOperator = operator.isRange() ? operator.getDialect() : "=";
        List<String> idFilters = new ArrayList<>();
        for (String element : ValueList.requireValues(value)) {
            String id = ValueList.unquote(element);
            try {
                Long.parseUnsignedLong(id);
            } catch (NumberFormatException e) {
                throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid id: " + element, e);
            }
            idFilters.add("(" + translator.translate(idOperator, id) + ")");
        }
        String equalFilter = "(" + String.join(" OR ", idFilters) + ")";
        if (operator == Operator.NE || operator == Operator.NOT_IN) {
            return "not(" + equalFilter + ")";
        }
        return equalFilter;
    }
}
