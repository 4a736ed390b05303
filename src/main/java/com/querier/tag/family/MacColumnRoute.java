package com.querier.tag.family;

import com.querier.query.encoder.MacValueEncoder;
import com.querier.query.filter.ExprNode;
import com.querier.query.filter.FilterNode;

import java.util.Optional;
import java.util.Set;

/**
 * MAC columns stored as unsigned 64-bit integers
 */
public class MacColumnRoute implements TagFamilyRoute {

    static final Set<String> MAC_COLUMNS = Set.of(
            "mac_0", "mac_1",
            "tunnel_tx_mac_0", "tunnel_tx_mac_1",
            "tunnel_rx_mac_0", "tunnel_rx_mac_1");

    @Override
    public boolean matches(String tagName) {
        return MAC_COLUMNS.contains(tagName);
    }

    @Override
    public Optional<FilterNode> translate(TagFilterRequest request) {
        String macs = MacValueEncoder.encodeMacs(request.getOperator(), request.getValue());
        return Optional.of(new ExprNode(request.getOriginalTag() + " " + request.getOperator().getDialect() + " " + macs));
    }
}
