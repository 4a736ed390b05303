package com.querier.prometheus;

import com.querier.query.filter.FilterNode;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Placeholder for a target-label predicate whose subquery is resolved in a
 * batch once the whole clause has been compiled.
 *
 * Until resolved it renders the subquery inline; afterwards it renders the
 * resolved target id list, or {@code 1!=1} when no target matched.
 */
public class TargetLabelFilter implements FilterNode {

    static final String NO_MATCH = "1!=1";

    private final String originFilter;
    private final String transFilter;
    private volatile String resolvedFilter;

    public TargetLabelFilter(String originFilter, String transFilter) {
        this.originFilter = originFilter;
        this.transFilter = transFilter;
    }

    public String getOriginFilter() {
        return originFilter;
    }

    /**
     * Query selecting the matching {@code target_id}s
     */
    public String getTransFilter() {
        return transFilter;
    }

    public boolean isResolved() {
        return resolvedFilter != null;
    }

    public void resolve(Collection<Long> targetIds) {
        if (targetIds.isEmpty()) {
            resolvedFilter = NO_MATCH;
        } else {
            resolvedFilter = targetIds.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(",", "toUInt64(target_id) IN (", ")"));
        }
    }

    @Override
    public String toSql() {
        if (resolvedFilter != null) {
            return resolvedFilter;
        }
        return "toUInt64(target_id) IN (" + transFilter + ")";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
