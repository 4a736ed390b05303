package com.querier.tag.family;

import com.querier.prometheus.PrometheusFilterTranslator;
import com.querier.prometheus.RemoteReadFilterTranslator;
import com.querier.query.CompilationContext;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;
import com.querier.tag.DefaultTagTaxonomy;
import com.querier.tag.TagCategory;
import com.querier.tag.TagRegistry;

import java.util.Optional;

/**
 * Free-form {@code tag.<key>} and {@code attribute.<key>} references.
 *
 * On Prometheus tables {@code tag.} names a metric label: the remote-read
 * path resolves it through the subquery cache, other queries get an inline
 * membership subquery.
 */
public class FreeFormTagRoute implements TagFamilyRoute {

    static final String TAG_PREFIX = "tag.";
    static final String ATTRIBUTE_PREFIX = "attribute.";

    private final TagRegistry registry;
    private final PrometheusFilterTranslator prometheusFilterTranslator;
    private final RemoteReadFilterTranslator remoteReadFilterTranslator;

    public FreeFormTagRoute(TagRegistry registry,
                            PrometheusFilterTranslator prometheusFilterTranslator,
                            RemoteReadFilterTranslator remoteReadFilterTranslator) {
        this.registry = registry;
        this.prometheusFilterTranslator = prometheusFilterTranslator;
        this.remoteReadFilterTranslator = remoteReadFilterTranslator;
    }

    @Override
    public boolean matches(String tagName) {
        return tagName.startsWith(TAG_PREFIX) || tagName.startsWith(ATTRIBUTE_PREFIX);
    }

    @Override
    public Optional<FilterNode> translate(TagFilterRequest request) {
        CompilationContext context = request.getContext();
        String tagName = request.getTagName();
        String prefix = tagName.startsWith(TAG_PREFIX) ? TAG_PREFIX : ATTRIBUTE_PREFIX;
        if (TAG_PREFIX.equals(prefix)) {
            if (context.isRemoteRead()) {
                return Optional.of(remoteReadFilterTranslator.translate(tagName, request.getOperator(),
                        request.getValue(), request.getOriginFilter(), context));
            }
            if (DefaultTagTaxonomy.DB_PROMETHEUS.equals(context.getDb())) {
                return Optional.of(new ExprNode(prometheusFilterTranslator.translate(tagName, context.getTable(),
                        request.getOperator(), request.getValue())));
            }
        }
        String key = tagName.substring(prefix.length());
        return registry.getKeyedTag(prefix, context.getDb(), context.getTable(), TagCategory.PLAIN)
                .map(descriptor -> new ExprNode(descriptor.render(key, request.getOperator(), request.getValue())));
    }
}
