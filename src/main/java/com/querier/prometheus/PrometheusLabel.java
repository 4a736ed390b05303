package com.querier.prometheus;

import java.util.Optional;

/**
 * A metric label reference resolved against the registry
 */
public class PrometheusLabel {
    private final String labelName;
    private final int metricId;
    private final int labelNameId;
    private final AppLabelLayout appLabel;

    public PrometheusLabel(String labelName, int metricId, int labelNameId, AppLabelLayout appLabel) {
        this.labelName = labelName;
        this.metricId = metricId;
        this.labelNameId = labelNameId;
        this.appLabel = appLabel;
    }

    public String getLabelName() {
        return labelName;
    }

    public int getMetricId() {
        return metricId;
    }

    public int getLabelNameId() {
        return labelNameId;
    }

    /**
     * Inline column layout when this is an app label; empty for target labels
     */
    public Optional<AppLabelLayout> getAppLabel() {
        return Optional.ofNullable(appLabel);
    }

    public boolean isAppLabel() {
        return appLabel != null;
    }
}
