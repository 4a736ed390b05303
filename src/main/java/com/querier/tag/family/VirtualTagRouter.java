package com.querier.tag.family;

import com.querier.prometheus.PrometheusFilterTranslator;
import com.querier.prometheus.RemoteReadFilterTranslator;
import com.querier.query.filter.EnumFilterBuilder;
import com.querier.query.filter.FilterNode;
import com.querier.tag.TagFamily;
import com.querier.tag.TagRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Dispatches tags the taxonomy does not know by name to their virtual
 * family. Routes are tried in order; the first whose pattern matches
 * handles the tag.
 */
@Component
public class VirtualTagRouter {

    private static final Logger logger = LoggerFactory.getLogger(VirtualTagRouter.class);

    private final List<TagFamilyRoute> routes;

    public VirtualTagRouter(TagRegistry registry,
                            PrometheusFilterTranslator prometheusFilterTranslator,
                            RemoteReadFilterTranslator remoteReadFilterTranslator,
                            EnumFilterBuilder enumFilterBuilder) {
        List<TagFamilyRoute> ordered = new ArrayList<>();
        ordered.add(new MacColumnRoute());
        ordered.add(new TapPortRoute());
        for (TagFamily family : TagFamily.values()) {
            ordered.add(new KeyedFamilyRoute(family, registry));
        }
        ordered.add(new FreeFormTagRoute(registry, prometheusFilterTranslator, remoteReadFilterTranslator));
        ordered.add(new EnumRoute(enumFilterBuilder));
        this.routes = Collections.unmodifiableList(ordered);
    }

    public Optional<TagFamilyRoute> findRoute(String tagName) {
        for (TagFamilyRoute route : routes) {
            if (route.matches(tagName)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    /**
     * Translate through the first matching route; empty when no family
     * claims the tag or the family is not defined on the active table
     */
    public Optional<FilterNode> route(TagFilterRequest request) {
        Optional<TagFamilyRoute> route = findRoute(request.getTagName());
        if (route.isEmpty()) {
            return Optional.empty();
        }
        logger.debug("Tag {} routed to {}", request.getTagName(), route.get().getClass().getSimpleName());
        return route.get().translate(request);
    }
}
