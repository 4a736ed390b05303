package com.querier.prometheus;

import com.querier.query.CompilationContext;
import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.FilterMetrics;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;
import com.querier.query.operator.Operator;
import com.querier.storage.QueryClient;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Label filters for the remote-read path.
 *
 * App labels are resolved to their value ids right away, through the
 * subquery cache. Target labels are queued on the compilation context and
 * resolved in one batch after the clause is compiled.
 */
@Component
public class RemoteReadFilterTranslator {

    private static final Logger logger = LoggerFactory.getLogger(RemoteReadFilterTranslator.class);

    private final PrometheusFilterTranslator prometheusFilterTranslator;
    private final PrometheusSubqueryCache cache;
    private final QueryClient queryClient;
    private final FilterMetrics metrics;

    public RemoteReadFilterTranslator(PrometheusFilterTranslator prometheusFilterTranslator,
                                      PrometheusSubqueryCache cache,
                                      QueryClient queryClient,
                                      FilterMetrics metrics) {
        this.prometheusFilterTranslator = prometheusFilterTranslator;
        this.cache = cache;
        this.queryClient = queryClient;
        this.metrics = metrics;
    }

    /**
     * @param originFilter verbatim text of the comparison, used as the cache key
     * @throws FilterCompilationException {@code UNKNOWN_REGISTRY_ENTRY} for unknown names,
     *         {@code BACKING_STORE_FAILURE} when the value id lookup fails
     */
    public FilterNode translate(String tagName, Operator operator, String value,
                                String originFilter, CompilationContext context) {
        PrometheusLabel label = prometheusFilterTranslator.resolveLabel(tagName, context.getTable());
        if (label.isAppLabel()) {
            return new ExprNode(appLabelFilter(label, operator, value, originFilter));
        }
        String transFilter = PrometheusFilterTranslator.targetQuery(label, operator, value) + " GROUP BY target_id";
        TargetLabelFilter targetLabelFilter = new TargetLabelFilter(originFilter, transFilter);
        context.addTargetLabelFilter(targetLabelFilter);
        metrics.recordTargetLabelDeferred();
        logger.debug("Deferred target label filter {}", originFilter);
        return targetLabelFilter;
    }

    private String appLabelFilter(PrometheusLabel label, Operator operator, String value, String originFilter) {
        return cache.getFresh(originFilter)
                .map(filter -> {
                    metrics.recordCacheHit();
                    return filter;
                })
                .orElseGet(() -> {
                    metrics.recordCacheMiss();
                    String filter = lookupAppLabelFilter(label, operator, value);
                    cache.put(originFilter, filter);
                    return filter;
                });
    }

    private String lookupAppLabelFilter(PrometheusLabel label, Operator operator, String value) {
        String sql = PrometheusFilterTranslator.appLabelValueQuery(label, operator, value) + " GROUP BY label_value_id";
        List<List<Object>> rows;
        Timer.Sample sample = metrics.startLookupTimer();
        try {
            rows = queryClient.query(sql);
        } catch (DataAccessException e) {
            logger.error("Label value lookup failed: {}", sql, e);
            throw new FilterCompilationException(ErrorKind.BACKING_STORE_FAILURE,
                    "label value lookup failed: " + e.getMessage(), e);
        } finally {
            metrics.recordLookupLatency(sample);
        }
        List<String> valueIds = new ArrayList<>();
        for (List<Object> row : rows) {
            valueIds.add(String.valueOf(toLong(row.get(0))));
        }
        if (valueIds.isEmpty()) {
            return TargetLabelFilter.NO_MATCH;
        }
        return label.getAppLabel().get().getColumn() + " IN (" + String.join(",", valueIds) + ")";
    }

    static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new FilterCompilationException(ErrorKind.BACKING_STORE_FAILURE,
                    "unexpected id value: " + value, e);
        }
    }
}
