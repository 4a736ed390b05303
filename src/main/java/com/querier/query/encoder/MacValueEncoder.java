package com.querier.query.encoder;

import com.querier.query.FilterCompilationException;
import com.querier.query.FilterCompilationException.ErrorKind;
import com.querier.query.operator.Operator;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes MAC and tap port literals into the quoted integers stored in the flow tables
 */
public final class MacValueEncoder {

    /** OUI prefix completing a bare 4-byte tap port MAC suffix */
    private static final String TAP_PORT_MAC_PREFIX = "00:00:";

    private MacValueEncoder() {
        throw new UnsupportedOperationException("MacValueEncoder is a utility class and cannot be instantiated");
    }

    /**
     * Encode a MAC literal or list as quoted unsigned 64-bit integers
     *
     * @throws FilterCompilationException if the list is empty or any element is not a MAC address
     */
    public static String encodeMacs(Operator operator, String value) {
        List<String> macs = new ArrayList<>();
        for (String element : ValueList.requireValues(value)) {
            String mac = ValueList.unquote(element);
            try {
                macs.add(ValueList.quote(Long.toUnsignedString(MacAddresses.toLong(mac))));
            } catch (IllegalArgumentException e) {
                throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, e.getMessage(), e);
            }
        }
        return ValueList.join(macs, operator);
    }

    /**
     * Encode a tap port list. Each element is classified on its own: an IPv4
     * becomes an unsigned 32-bit integer, a MAC suffix an unsigned 64-bit
     * integer, anything else is passed through quoted.
     *
     * @throws FilterCompilationException for IPv6 literals, which tap ports never carry
     */
    public static String encodeTapPorts(Operator operator, String value) {
        List<String> ports = new ArrayList<>();
        for (String element : ValueList.requireValues(value)) {
            String port = ValueList.unquote(element);
            InetAddress ip = tryParseIp(port);
            if (ip != null) {
                if (!(ip instanceof Inet4Address)) {
                    throw new FilterCompilationException(ErrorKind.MALFORMED_LITERAL, "invalid ipv4 mac: " + port);
                }
                ports.add(ValueList.quote(Long.toString(IpAddresses.toUnsignedInt((Inet4Address) ip))));
            } else if (MacAddresses.isValid(TAP_PORT_MAC_PREFIX + port)) {
                long mac = MacAddresses.toLong(TAP_PORT_MAC_PREFIX + port);
                ports.add(ValueList.quote(Long.toUnsignedString(mac)));
            } else {
                ports.add(ValueList.quote(port));
            }
        }
        return ValueList.join(ports, operator);
    }

    private static InetAddress tryParseIp(String text) {
        try {
            return IpAddresses.parse(text);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
