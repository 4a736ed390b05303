package com.querier.query.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulated predicates of one WHERE or HAVING clause, conjoined with AND
 */
public class Filters {
    private final List<FilterNode> nodes = new ArrayList<>();

    public void add(FilterNode node) {
        if (node != null) {
            nodes.add(node);
        }
    }

    public List<FilterNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * True when no predicate renders any text
     */
    public boolean isNull() {
        return nodes.stream().allMatch(FilterNode::isEmpty);
    }

    public String toSql() {
        return nodes.stream()
                .filter(node -> !node.isEmpty())
                .map(FilterNode::toSql)
                .collect(Collectors.joining(" AND "));
    }
}
