package com.querier.tag.family;

import com.querier.query.CompilationContext;
import com.querier.query.operator.Operator;

/**
 * One comparison handed to the virtual tag families, operator already
 * normalized and like-wildcards already rewritten
 */
public class TagFilterRequest {
    private final String originalTag;
    private final String tagName;
    private final Operator operator;
    private final String value;
    private final String originFilter;
    private final CompilationContext context;

    public TagFilterRequest(String originalTag, String tagName, Operator operator, String value,
                            String originFilter, CompilationContext context) {
        this.originalTag = originalTag;
        this.tagName = tagName;
        this.operator = operator;
        this.value = value;
        this.originFilter = originFilter;
        this.context = context;
    }

    /**
     * The tag exactly as written in the query, alias included
     */
    public String getOriginalTag() {
        return originalTag;
    }

    /**
     * Canonical, back-quote-stripped tag name
     */
    public String getTagName() {
        return tagName;
    }

    public Operator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    /**
     * Verbatim text of the untranslated comparison
     */
    public String getOriginFilter() {
        return originFilter;
    }

    public CompilationContext getContext() {
        return context;
    }
}
