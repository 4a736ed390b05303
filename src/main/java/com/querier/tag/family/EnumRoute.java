package com.querier.tag.family;

import com.querier.query.filter.EnumFilterBuilder;
import com.querier.query.filter.FilterNode;

import java.util.Optional;

/**
 * {@code Enum(<tag>)} written as a plain comparison field
 */
public class EnumRoute implements TagFamilyRoute {

    private final EnumFilterBuilder enumFilterBuilder;

    public EnumRoute(EnumFilterBuilder enumFilterBuilder) {
        this.enumFilterBuilder = enumFilterBuilder;
    }

    @Override
    public boolean matches(String tagName) {
        return EnumFilterBuilder.isEnumReference(tagName);
    }

    @Override
    public Optional<FilterNode> translate(TagFilterRequest request) {
        return Optional.of(enumFilterBuilder.build(EnumFilterBuilder.enumArgument(request.getTagName()),
                request.getOperator(), request.getValue(), request.getContext()));
    }
}
