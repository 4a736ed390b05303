package com.querier.tag.family;

import com.querier.query.encoder.MacValueEncoder;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;

import java.util.Optional;

/**
 * {@code tap_port} values: IPv4 literals, bare 4-byte MAC suffixes or opaque names
 */
public class TapPortRoute implements TagFamilyRoute {

    static final String TAP_PORT = "tap_port";

    @Override
    public boolean matches(String tagName) {
        return TAP_PORT.equals(tagName);
    }

    @Override
    public Optional<FilterNode> translate(TagFilterRequest request) {
        String ports = MacValueEncoder.encodeTapPorts(request.getOperator(), request.getValue());
        return Optional.of(new ExprNode(request.getOriginalTag() + " " + request.getOperator().getDialect() + " " + ports));
    }
}
