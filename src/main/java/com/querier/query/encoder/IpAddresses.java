package com.querier.query.encoder;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * IP literal parsing and the two column encodings used by the flow tables:
 * upper-case hex (matching {@code hex(ip4)}/{@code hex(ip6)}) and unsigned
 * 32-bit integers for IPv4.
 *
 * Only literals are accepted; nothing here triggers a name lookup.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile("(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9a-fA-F:][0-9a-fA-F:.]*");

    private IpAddresses() {
        throw new UnsupportedOperationException("IpAddresses is a utility class and cannot be instantiated");
    }

    /**
     * Parse an IPv4 or IPv6 literal
     *
     * @throws IllegalArgumentException if the text is not an IP literal
     */
    public static InetAddress parse(String text) {
        String ip = text == null ? "" : text.trim();
        if (IPV4.matcher(ip).matches()) {
            String[] parts = ip.split("\\.");
            byte[] bytes = new byte[4];
            for (int i = 0; i < 4; i++) {
                int octet = Integer.parseInt(parts[i]);
                if (octet > 255) {
                    throw new IllegalArgumentException("invalid ip: " + text);
                }
                bytes[i] = (byte) octet;
            }
            return byAddress(bytes, text);
        }
        if (ip.indexOf(':') >= 0 && IPV6_CHARS.matcher(ip).matches()) {
            try {
                return InetAddress.getByName(ip);
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("invalid ip: " + text, e);
            }
        }
        throw new IllegalArgumentException("invalid ip: " + text);
    }

    /**
     * Upper-case hex of the address bytes, 8 digits for IPv4 and 32 for IPv6
     */
    public static String toHex(InetAddress address) {
        StringBuilder sb = new StringBuilder();
        for (byte b : address.getAddress()) {
            sb.append(String.format(Locale.ROOT, "%02X", b & 0xFF));
        }
        return sb.toString();
    }

    public static long toUnsignedInt(Inet4Address address) {
        byte[] bytes = address.getAddress();
        return ((bytes[0] & 0xFFL) << 24) | ((bytes[1] & 0xFFL) << 16) | ((bytes[2] & 0xFFL) << 8) | (bytes[3] & 0xFFL);
    }

    /**
     * Parse a CIDR such as {@code 10.0.0.1/24} into its masked address range
     *
     * @throws IllegalArgumentException if the prefix is malformed
     */
    public static Cidr parseCidr(String text) {
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("invalid cidr: " + text);
        }
        InetAddress base = parse(text.substring(0, slash));
        int bits = base.getAddress().length * 8;
        int prefix;
        try {
            prefix = Integer.parseInt(text.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid cidr: " + text, e);
        }
        if (prefix < 0 || prefix > bits) {
            throw new IllegalArgumentException("invalid cidr: " + text);
        }
        BigInteger value = new BigInteger(1, base.getAddress());
        BigInteger hostMask = BigInteger.ONE.shiftLeft(bits - prefix).subtract(BigInteger.ONE);
        BigInteger min = value.andNot(hostMask);
        BigInteger max = min.or(hostMask);
        return new Cidr(toAddress(min, bits, text), toAddress(max, bits, text));
    }

    private static InetAddress toAddress(BigInteger value, int bits, String text) {
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[bits / 8];
        // toByteArray may carry a leading sign byte or be shorter than the address
        int copy = Math.min(raw.length, bytes.length);
        System.arraycopy(raw, raw.length - copy, bytes, bytes.length - copy, copy);
        return byAddress(bytes, text);
    }

    private static InetAddress byAddress(byte[] bytes, String text) {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("invalid ip: " + text, e);
        }
    }

    /**
     * Inclusive address range of a CIDR block
     */
    public static final class Cidr {
        private final InetAddress min;
        private final InetAddress max;

        Cidr(InetAddress min, InetAddress max) {
            this.min = min;
            this.max = max;
        }

        public InetAddress getMin() {
            return min;
        }

        public InetAddress getMax() {
            return max;
        }
    }
}
