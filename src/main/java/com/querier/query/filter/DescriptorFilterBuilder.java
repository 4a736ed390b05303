package com.querier.query.filter;

import com.querier.query.encoder.BooleanTriStateEncoder;
import com.querier.query.encoder.IdListEncoder;
import com.querier.query.encoder.IpFilterEncoder;
import com.querier.query.encoder.IpVersionEncoder;
import com.querier.query.encoder.ValueList;
import com.querier.query.operator.Operator;
import com.querier.tag.TagDescriptor;

import java.util.List;

/**
 * Compiles a comparison on a registered tag, encoding the value the way the
 * tag's columns store it
 */
public final class DescriptorFilterBuilder {

    private DescriptorFilterBuilder() {
        throw new UnsupportedOperationException("DescriptorFilterBuilder is a utility class and cannot be instantiated");
    }

    public static FilterNode build(TagDescriptor descriptor, Operator operator, String value) {
        String whereFilter;
        switch (descriptor.getEncoding()) {
            case IP:
                whereFilter = IpFilterEncoder.encode(operator, value, descriptor.getWhereTranslator());
                break;
            case ID:
                whereFilter = IdListEncoder.encode(operator, value, descriptor.getWhereTranslator());
                break;
            case IP_VERSION:
                whereFilter = IpVersionEncoder.encode(operator, value, descriptor.getWhereTranslator());
                break;
            case BOOLEAN_TRI_STATE:
                whereFilter = BooleanTriStateEncoder.encode(operator, value, descriptor.getWhereTranslator());
                break;
            case ARRAY:
                whereFilter = arrayFilter(descriptor, operator, value);
                break;
            default:
                whereFilter = descriptor.render(operator, value);
        }
        if (whereFilter.isEmpty()) {
            return ExprNode.empty();
        }
        return new ExprNode("(" + whereFilter + ")");
    }

    private static String arrayFilter(TagDescriptor descriptor, Operator operator, String value) {
        List<String> elements = ValueList.requireValues(value);
        String filter = descriptor.getWhereTranslator().translate(operator.getDialect(), String.join(",", elements));
        return operator.isNegated() ? "not(" + filter + ")" : filter;
    }
}
