package com.querier.tag;

import com.querier.query.operator.Operator;

/**
 * Translation rules of a keyed tag: a virtual family such as
 * {@code k8s.label.<key>}, a free-form {@code tag.<key>}, or an enum tag
 * keyed by its dictionary name
 */
public class KeyedTagDescriptor {
    private final String name;
    private final TagCategory category;
    private final KeyedWhereTranslator whereTranslator;
    private final KeyedWhereTranslator whereRegexpTranslator;

    public KeyedTagDescriptor(String name, TagCategory category,
                              KeyedWhereTranslator whereTranslator,
                              KeyedWhereTranslator whereRegexpTranslator) {
        this.name = name;
        this.category = category;
        this.whereTranslator = whereTranslator;
        this.whereRegexpTranslator = whereRegexpTranslator;
    }

    public String getName() {
        return name;
    }

    public TagCategory getCategory() {
        return category;
    }

    /**
     * Fill the template. Subquery families render negated operators as
     * {@code not(<positive form>)}.
     */
    public String render(String key, Operator operator, String value) {
        if (category == TagCategory.SUBQUERY && operator.isNegated()) {
            return "not(" + renderDirect(key, operator.positive(), value) + ")";
        }
        return renderDirect(key, operator, value);
    }

    private String renderDirect(String key, Operator operator, String value) {
        if (operator.isRegexp()) {
            return whereRegexpTranslator.translate(key, operator.getDialect(), value);
        }
        return whereTranslator.translate(key, operator.getDialect(), value);
    }
}
