package com.querier.prometheus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry holder republished by the out-of-band refresher.
 *
 * Readers always see one consistent snapshot of the three tables.
 */
@Component
public class InMemoryPrometheusRegistry implements PrometheusRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPrometheusRegistry.class);

    private volatile Snapshot snapshot = new Snapshot(Map.of(), Map.of(), Map.of());

    @Override
    public Optional<Integer> getMetricId(String metricName) {
        return Optional.ofNullable(snapshot.metricIds.get(metricName));
    }

    @Override
    public Optional<Integer> getLabelNameId(String labelName) {
        return Optional.ofNullable(snapshot.labelNameIds.get(labelName));
    }

    @Override
    public List<AppLabelLayout> getAppLabelLayouts(String metricName) {
        return snapshot.appLabelLayouts.getOrDefault(metricName, Collections.emptyList());
    }

    /**
     * Swap all three tables at once
     */
    public void replace(Map<String, Integer> metricIds,
                        Map<String, Integer> labelNameIds,
                        Map<String, List<AppLabelLayout>> appLabelLayouts) {
        snapshot = new Snapshot(Map.copyOf(metricIds), Map.copyOf(labelNameIds), Map.copyOf(appLabelLayouts));
        logger.info("Prometheus registry replaced: {} metrics, {} label names, {} app-label layouts",
                metricIds.size(), labelNameIds.size(), appLabelLayouts.size());
    }

    private static final class Snapshot {
        private final Map<String, Integer> metricIds;
        private final Map<String, Integer> labelNameIds;
        private final Map<String, List<AppLabelLayout>> appLabelLayouts;

        private Snapshot(Map<String, Integer> metricIds,
                         Map<String, Integer> labelNameIds,
                         Map<String, List<AppLabelLayout>> appLabelLayouts) {
            this.metricIds = metricIds;
            this.labelNameIds = labelNameIds;
            this.appLabelLayouts = appLabelLayouts;
        }
    }
}
