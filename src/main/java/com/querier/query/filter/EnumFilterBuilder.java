package com.querier.query.filter;

import com.querier.query.CompilationContext;
import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.encoder.ValueList;
import com.querier.query.operator.Operator;
import com.querier.query.operator.OperatorNormalizer;
import com.querier.tag.DeviceRoles;
import com.querier.tag.EnumDictionary;
import com.querier.tag.KeyedTagDescriptor;
import com.querier.tag.TagCategory;
import com.querier.tag.TagRegistry;
import com.querier.tag.TagResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compiles {@code Enum(<tag>) <op> <value>} filters.
 *
 * The value is matched against the tag's enum dictionary. For {@code =} and
 * {@code !=} the raw column is compared too, so values missing from the
 * dictionary are still matched or excluded.
 */
@Component
public class EnumFilterBuilder {

    private static final Logger logger = LoggerFactory.getLogger(EnumFilterBuilder.class);

    public static final String ENUM_FUNCTION = "Enum";

    private final TagRegistry registry;

    public EnumFilterBuilder(TagRegistry registry) {
        this.registry = registry;
    }

    /**
     * True for a function-style tag reference such as {@code Enum(protocol)}
     */
    public static boolean isEnumReference(String tag) {
        return TagResolver.stripTagName(tag).startsWith(ENUM_FUNCTION + "(");
    }

    /**
     * Extract {@code protocol} from {@code Enum(protocol)}
     */
    public static String enumArgument(String tag) {
        String name = TagResolver.stripTagName(tag);
        if (name.startsWith(ENUM_FUNCTION + "(")) {
            name = name.substring(ENUM_FUNCTION.length() + 1);
        }
        if (name.endsWith(")")) {
            name = name.substring(0, name.length() - 1);
        }
        return TagResolver.stripTagName(name);
    }

    /**
     * @param tagArg the tag wrapped by {@code Enum(...)}
     * @throws FilterCompilationException {@code UNKNOWN_REGISTRY_ENTRY} when the tag has no dictionary
     */
    public FilterNode build(String tagArg, Operator operator, String rawValue, CompilationContext context) {
        String tagName = TagResolver.stripTagName(tagArg);
        String enumTag = DeviceRoles.stripSuffix(tagName);
        EnumDictionary dictionary = registry.getDescriptions()
                .getEnumDictionary(context.getDb(), context.getTable(), enumTag)
                .orElseThrow(() -> new FilterCompilationException(ErrorKind.UNKNOWN_REGISTRY_ENTRY,
                        String.format("no tag %s in %s.%s", tagName, context.getDb(), context.getTable())));
        KeyedTagDescriptor descriptor = registry
                .getKeyedTag(tagName, context.getDb(), context.getTable(), TagCategory.ENUM)
                .orElseThrow(() -> new FilterCompilationException(ErrorKind.UNKNOWN_REGISTRY_ENTRY,
                        String.format("no tag %s in %s.%s", tagName, context.getDb(), context.getTable())));

        String value = OperatorNormalizer.rewriteWildcard(operator, rawValue);
        String dictionaryFilter = descriptor.render(dictionary.getName(), operator, value);
        String whereFilter;
        if (operator == Operator.EQ || operator == Operator.NE) {
            String rawFilter = rawValueFilter(tagName, operator, value, dictionary);
            if (rawFilter == null) {
                whereFilter = dictionaryFilter;
            } else {
                String junction = operator == Operator.EQ ? " OR " : " AND ";
                whereFilter = "(" + dictionaryFilter + ")" + junction + "(" + rawFilter + ")";
            }
        } else {
            whereFilter = dictionaryFilter;
        }
        logger.debug("Enum filter on {} uses dictionary {}", tagName, dictionary);
        return new ExprNode("(" + whereFilter + ")");
    }

    /**
     * Comparison of the stored value itself, or null when an integer-keyed
     * dictionary is queried with a non-numeric value
     */
    private static String rawValueFilter(String tagName, Operator operator, String value, EnumDictionary dictionary) {
        if (!dictionary.isIntegerKeyed()) {
            return tagName + " " + operator.getDialect() + " " + value;
        }
        try {
            long number = Long.parseLong(ValueList.unquote(value));
            return tagName + " " + operator.getDialect() + " toUInt64(" + number + ")";
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
