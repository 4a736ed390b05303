package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;
import com.querier.tag.WhereTranslator;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles IP tag filters. Addresses are compared as hex strings; a CIDR
 * becomes a closed range, or a single bound for range operators.
 */
public final class IpFilterEncoder {

    private IpFilterEncoder() {
        throw new UnsupportedOperationException("IpFilterEncoder is a utility class and cannot be instantiated");
    }

    /**
     * @param operator normalized operator
     * @param value literal or list of IPs and CIDRs
     * @param translator the tag's template, filled with (operator, hex literal)
     * @return the predicate, negated operators wrapped in {@code not(...)}
     */
    public static String encode(Operator operator, String value, WhereTranslator translator) {
        List<String> cidrFilters = new ArrayList<>();
        List<String> ips = new ArrayList<>();
        for (String element : ValueList.requireValues(value)) {
            String ip = ValueList.unquote(element);
            if (ip.contains("/")) {
                cidrFilters.add(cidrFilter(operator, ip, translator));
            } else {
                ips.add(ValueList.quote(IpAddresses.toHex(parse(ip))));
            }
        }

        List<String> finalFilters = new ArrayList<>();
        if (!cidrFilters.isEmpty()) {
            finalFilters.add("(" + String.join(" OR ", cidrFilters) + ")");
        }
        if (!ips.isEmpty()) {
            finalFilters.add(ipsFilter(operator, ips, translator));
        }
        String equalFilter = "(" + String.join(" OR ", finalFilters) + ")";
        if (operator == Operator.NE || operator == Operator.NOT_IN) {
            return "not(" + equalFilter + ")";
        }
        return equalFilter;
    }

    private static String cidrFilter(Operator operator, String cidrText, WhereTranslator translator) {
        IpAddresses.Cidr cidr;
        try {
            cidr = IpAddresses.parseCidr(cidrText);
        } catch (IllegalArgumentException e) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, e.getMessage(), e);
        }
        String minIp = ValueList.quote(IpAddresses.toHex(cidr.getMin()));
        String maxIp = ValueList.quote(IpAddresses.toHex(cidr.getMax()));
        if (operator == Operator.GE || operator == Operator.GT) {
            return translator.translate(operator.getDialect(), maxIp);
        }
        if (operator == Operator.LE || operator == Operator.LT) {
            return translator.translate(operator.getDialect(), minIp);
        }
        return "(" + translator.translate(">=", minIp) + " AND " + translator.translate("<=", maxIp) + ")";
    }

    private static String ipsFilter(Operator operator, List<String> ips, WhereTranslator translator) {
        if (operator.isRange()) {
            List<String> ipFilters = new ArrayList<>();
            for (String ip : ips) {
                ipFilters.add(translator.translate(operator.getDialect(), ip));
            }
            return "(" + String.join(" OR ", ipFilters) + ")";
        }
        String ipsStr = String.join(",", ips);
        if (operator.isList()) {
            return "(" + translator.translate("in", "(" + ipsStr + ")") + ")";
        }
        return "(" + translator.translate("=", ipsStr) + ")";
    }

    private static InetAddress parse(String ip) {
        try {
            return IpAddresses.parse(ip);
        } catch (IllegalArgumentException e) {
            throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, e.getMessage(), e);
        }
    }
}
