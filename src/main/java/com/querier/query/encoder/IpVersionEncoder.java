package com.querier.query.encoder;

import com.querier.query.operator.Operator;
import com.querier.tag.WhereTranslator;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps {@code ip_version} values onto the stored {@code is_ipv4} flag
 */
public final class IpVersionEncoder {

    private IpVersionEncoder() {
        throw new UnsupportedOperationException("IpVersionEncoder is a utility class and cannot be instantiated");
    }

    public static String encode(Operator operator, String value, WhereTranslator translator) {
        List<String> versions = new ArrayList<>();
        for (String element : ValueList.requireValues(value)) {
            versions.add("4".equals(ValueList.unquote(element)) ? "1" : "0");
        }
        return translator.translate(operator.getDialect(), ValueList.join(versions, operator));
    }
}
