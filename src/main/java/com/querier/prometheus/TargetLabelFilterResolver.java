package com.querier.prometheus;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.FilterMetrics;
import com.querier.storage.QueryClient;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves every deferred target-label filter of a statement with a single
 * backing-store query, tagging each subquery's rows with its position
 */
@Component
public class TargetLabelFilterResolver {

    private static final Logger logger = LoggerFactory.getLogger(TargetLabelFilterResolver.class);

    private final QueryClient queryClient;
    private final FilterMetrics metrics;

    public TargetLabelFilterResolver(QueryClient queryClient, FilterMetrics metrics) {
        this.queryClient = queryClient;
        this.metrics = metrics;
    }

    /**
     * @throws FilterCompilationException with {@code BACKING_STORE_FAILURE} if the batch query fails
     */
    public void resolve(List<TargetLabelFilter> filters) {
        if (filters.isEmpty()) {
            return;
        }
        String sql = batchQuery(filters);
        List<List<Object>> rows;
        Timer.Sample sample = metrics.startLookupTimer();
        try {
            rows = queryClient.query(sql);
        } catch (DataAccessException e) {
            logger.error("Target label resolution failed for {} filters", filters.size(), e);
            throw new FilterCompilationException(ErrorKind.BACKING_STORE_FAILURE,
                    "target label lookup failed: " + e.getMessage(), e);
        } finally {
            metrics.recordLookupLatency(sample);
        }

        List<Set<Long>> targetIds = new ArrayList<>();
        for (int i = 0; i < filters.size(); i++) {
            targetIds.add(new LinkedHashSet<>());
        }
        for (List<Object> row : rows) {
            int index = (int) RemoteReadFilterTranslator.toLong(row.get(0));
            if (index < 0 || index >= filters.size()) {
                throw new FilterCompilationException(ErrorKind.BACKING_STORE_FAILURE,
                        "unexpected filter index in target label batch: " + index);
            }
            targetIds.get(index).add(RemoteReadFilterTranslator.toLong(row.get(1)));
        }
        for (int i = 0; i < filters.size(); i++) {
            filters.get(i).resolve(targetIds.get(i));
        }
        metrics.recordTargetLabelBatch();
        logger.debug("Resolved {} target label filters from {} rows", filters.size(), rows.size());
    }

    static String batchQuery(List<TargetLabelFilter> filters) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < filters.size(); i++) {
            parts.add("SELECT " + i + " AS filter_index, target_id FROM (" + filters.get(i).getTransFilter() + ")");
        }
        return String.join(" UNION ALL ", parts);
    }
}
