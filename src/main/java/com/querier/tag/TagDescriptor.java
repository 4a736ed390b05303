package com.querier.tag;

import com.querier.query.operator.Operator;

import java.util.Objects;

/**
 * Translation rules of one plain or subquery tag on a given table
 */
public class TagDescriptor {
    private final String name;
    private final TagCategory category;
    private final ValueEncoding encoding;
    private final WhereTranslator whereTranslator;
    private final WhereTranslator whereRegexpTranslator;

    private TagDescriptor(Builder builder) {
        this.name = builder.name;
        this.category = builder.category;
        this.encoding = builder.encoding;
        this.whereTranslator = builder.whereTranslator;
        this.whereRegexpTranslator = builder.whereRegexpTranslator != null
                ? builder.whereRegexpTranslator
                : builder.whereTranslator;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public TagCategory getCategory() {
        return category;
    }

    public ValueEncoding getEncoding() {
        return encoding;
    }

    public WhereTranslator getWhereTranslator() {
        return whereTranslator;
    }

    public WhereTranslator getWhereRegexpTranslator() {
        return whereRegexpTranslator;
    }

    /**
     * Fill the template for an already encoded value. Subquery tags render
     * negated operators as {@code not(<positive form>)}.
     */
    public String render(Operator operator, String value) {
        if (category == TagCategory.SUBQUERY && operator.isNegated()) {
            return "not(" + renderDirect(operator.positive(), value) + ")";
        }
        return renderDirect(operator, value);
    }

    private String renderDirect(Operator operator, String value) {
        if (operator.isRegexp()) {
            return whereRegexpTranslator.translate(operator.getDialect(), value);
        }
        return whereTranslator.translate(operator.getDialect(), value);
    }

    public static class Builder {
        private final String name;
        private TagCategory category = TagCategory.PLAIN;
        private ValueEncoding encoding = ValueEncoding.DEFAULT;
        private WhereTranslator whereTranslator;
        private WhereTranslator whereRegexpTranslator;

        private Builder(String name) {
            this.name = name;
        }

        public Builder category(TagCategory category) {
            this.category = category;
            return this;
        }

        public Builder encoding(ValueEncoding encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder where(WhereTranslator translator) {
            this.whereTranslator = translator;
            return this;
        }

        public Builder whereRegexp(WhereTranslator translator) {
            this.whereRegexpTranslator = translator;
            return this;
        }

        public TagDescriptor build() {
            Objects.requireNonNull(whereTranslator, "where translator is required for tag " + name);
            return new TagDescriptor(this);
        }
    }
}
