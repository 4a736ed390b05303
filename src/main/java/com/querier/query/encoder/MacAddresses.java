package com.querier.query.encoder;

import java.util.Locale;

/**
 * Conversion between 48-bit MAC literals and their unsigned 64-bit column encoding.
 * Accepts {@code aa:bb:cc:dd:ee:ff}, {@code aa-bb-cc-dd-ee-ff} and {@code aabb.ccdd.eeff}.
 */
public final class MacAddresses {

    private static final int MAC_BYTES = 6;

    private MacAddresses() {
        throw new UnsupportedOperationException("MacAddresses is a utility class and cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException if the text is not a 48-bit MAC address
     */
    public static long toLong(String text) {
        String hex = toHexDigits(text);
        if (hex.length() != MAC_BYTES * 2) {
            throw new IllegalArgumentException("invalid MAC address: " + text);
        }
        return Long.parseUnsignedLong(hex, 16);
    }

    /**
     * Canonical lower-case colon form of an encoded MAC
     */
    public static String toCanonical(long value) {
        StringBuilder sb = new StringBuilder(17);
        for (int i = MAC_BYTES - 1; i >= 0; i--) {
            int octet = (int) ((value >>> (i * 8)) & 0xFF);
            sb.append(String.format(Locale.ROOT, "%02x", octet));
            if (i > 0) {
                sb.append(':');
            }
        }
        return sb.toString();
    }

    public static boolean isValid(String text) {
        try {
            toLong(text);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String toHexDigits(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("invalid MAC address: " + text);
        }
        if (text.indexOf('.') >= 0) {
            String[] groups = text.split("\\.", -1);
            if (groups.length != 3) {
                throw new IllegalArgumentException("invalid MAC address: " + text);
            }
            StringBuilder sb = new StringBuilder();
            for (String group : groups) {
                sb.append(requireHex(group, 4, text));
            }
            return sb.toString();
        }
        char separator = text.indexOf(':') >= 0 ? ':' : '-';
        String[] octets = text.split(separator == ':' ? ":" : "-", -1);
        if (octets.length != MAC_BYTES) {
            throw new IllegalArgumentException("invalid MAC address: " + text);
        }
        StringBuilder sb = new StringBuilder();
        for (String octet : octets) {
            sb.append(requireHex(octet, 2, text));
        }
        return sb.toString();
    }

    private static String requireHex(String part, int length, String text) {
        if (part.length() != length) {
            throw new IllegalArgumentException("invalid MAC address: " + text);
        }
        for (int i = 0; i < part.length(); i++) {
            if (Character.digit(part.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("invalid MAC address: " + text);
            }
        }
        return part;
    }
}
