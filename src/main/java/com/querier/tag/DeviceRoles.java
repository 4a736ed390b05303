package com.querier.tag;

/**
 * Helpers for the {@code _0}/{@code _1} suffix marking the client or server
 * side of a bidirectional record
 */
public final class DeviceRoles {

    public static final String CLIENT_SUFFIX = "_0";
    public static final String SERVER_SUFFIX = "_1";

    private DeviceRoles() {
        throw new UnsupportedOperationException("DeviceRoles is a utility class and cannot be instantiated");
    }

    public static String suffixOf(String tagName) {
        if (tagName.endsWith(CLIENT_SUFFIX)) {
            return CLIENT_SUFFIX;
        }
        if (tagName.endsWith(SERVER_SUFFIX)) {
            return SERVER_SUFFIX;
        }
        return "";
    }

    public static String stripSuffix(String tagName) {
        String suffix = suffixOf(tagName);
        return tagName.substring(0, tagName.length() - suffix.length());
    }
}
