package com.querier.prometheus;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the metric and label name to id tables.
 * An absent name is definitive, never a transient miss.
 */
public interface PrometheusRegistry {

    Optional<Integer> getMetricId(String metricName);

    Optional<Integer> getLabelNameId(String labelName);

    /**
     * App-label layout of a metric table, empty when it stores none inline
     */
    List<AppLabelLayout> getAppLabelLayouts(String metricName);
}
