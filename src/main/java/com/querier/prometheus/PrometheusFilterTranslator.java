package com.querier.prometheus;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compiles {@code tag.<label>} filters on Prometheus metric tables.
 *
 * App labels are stored inline per metric and tested against their
 * positional value-id column; every other label is a target label, joined
 * through {@code target_id}.
 */
@Component
public class PrometheusFilterTranslator {

    private static final Logger logger = LoggerFactory.getLogger(PrometheusFilterTranslator.class);

    public static final String TAG_PREFIX = "tag.";

    private final PrometheusRegistry registry;

    public PrometheusFilterTranslator(PrometheusRegistry registry) {
        this.registry = registry;
    }

    /**
     * Resolve the metric and label ids behind a label tag
     *
     * @throws FilterCompilationException with {@code UNKNOWN_REGISTRY_ENTRY} naming the missing metric or label
     */
    public PrometheusLabel resolveLabel(String tagName, String table) {
        String labelName = tagName.startsWith(TAG_PREFIX) ? tagName.substring(TAG_PREFIX.length()) : tagName;
        int metricId = registry.getMetricId(table)
                .orElseThrow(() -> new FilterCompilationException(ErrorKind.UNKNOWN_REGISTRY_ENTRY,
                        String.format("%s not found", table)));
        int labelNameId = registry.getLabelNameId(labelName)
                .orElseThrow(() -> new FilterCompilationException(ErrorKind.UNKNOWN_REGISTRY_ENTRY,
                        String.format("%s not found", labelName)));
        AppLabelLayout appLabel = registry.getAppLabelLayouts(table).stream()
                .filter(layout -> layout.getLabelName().equals(labelName))
                .findFirst()
                .orElse(null);
        return new PrometheusLabel(labelName, metricId, labelNameId, appLabel);
    }

    /**
     * Membership predicate for a label comparison on a metric table
     */
    public String translate(String tagName, String table, Operator operator, String value) {
        PrometheusLabel label = resolveLabel(tagName, table);
        String filter;
        if (label.isAppLabel()) {
            filter = "toUInt64(" + label.getAppLabel().get().getColumn() + ") IN ("
                    + appLabelValueQuery(label, operator, value) + ")";
        } else {
            filter = "toUInt64(target_id) IN (" + targetQuery(label, operator, value) + ")";
        }
        logger.debug("Label {} on metric {} compiled as {} label", label.getLabelName(), table,
                label.isAppLabel() ? "app" : "target");
        return filter;
    }

    /**
     * Label value ids matching the comparison
     */
    public static String appLabelValueQuery(PrometheusLabel label, Operator operator, String value) {
        return "SELECT label_value_id FROM flow_tag.app_label_live_view WHERE label_name_id="
                + label.getLabelNameId() + " and " + labelValueCondition(operator, value);
    }

    /**
     * Target ids whose label matches the comparison
     */
    public static String targetQuery(PrometheusLabel label, Operator operator, String value) {
        return "SELECT target_id FROM flow_tag.target_label_live_view WHERE metric_id=" + label.getMetricId()
                + " and label_name_id=" + label.getLabelNameId() + " and " + labelValueCondition(operator, value);
    }

    static String labelValueCondition(Operator operator, String value) {
        if (operator.isRegexp()) {
            return operator.getDialect() + "(label_value," + value + ")";
        }
        return "label_value " + operator.getDialect() + " " + value;
    }
}
