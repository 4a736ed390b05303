package com.querier.tag.family;

import com.querier.query.filter.FilterNode;

import java.util.Optional;

/**
 * One entry of the virtual tag dispatch table
 */
public interface TagFamilyRoute {

    boolean matches(String tagName);

    /**
     * Translate a matching request. Empty when the family has no descriptor
     * on the active table, in which case the tag is passed through.
     */
    Optional<FilterNode> translate(TagFilterRequest request);
}
