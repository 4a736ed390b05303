package com.querier.tag.family;

import com.querier.query.CompilationContext;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;
import com.querier.tag.DeviceRoles;
import com.querier.tag.TagCategory;
import com.querier.tag.TagFamily;
import com.querier.tag.TagRegistry;

import java.util.Optional;

/**
 * Key/value families ({@code k8s.label.}, {@code cloud.tag.}, ...) compiled to
 * membership subqueries. The device role suffix selects the scoped columns
 * and is not part of the key.
 */
public class KeyedFamilyRoute implements TagFamilyRoute {

    private final TagFamily family;
    private final TagRegistry registry;

    public KeyedFamilyRoute(TagFamily family, TagRegistry registry) {
        this.family = family;
        this.registry = registry;
    }

    @Override
    public boolean matches(String tagName) {
        return family.matches(tagName);
    }

    @Override
    public Optional<FilterNode> translate(TagFilterRequest request) {
        String suffix = DeviceRoles.suffixOf(request.getTagName());
        String key = DeviceRoles.stripSuffix(request.getTagName()).substring(family.getPrefix().length());
        CompilationContext context = request.getContext();
        return registry.getKeyedTag(family.descriptorName(suffix), context.getDb(), context.getTable(), TagCategory.SUBQUERY)
                .map(descriptor -> new ExprNode(descriptor.render(key, request.getOperator(), request.getValue())));
    }
}
