package com.pgcluster.ha.util;

import java.util.regex.Pattern;

/**
 * Utility class for node address handling.
 */
public final class NetworkUtils {

    private static final Pattern SAFE_HOST = Pattern.compile("^[A-Za-z0-9.:\\-]+$");

    private NetworkUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Check that an address is a bare IP or hostname before it is placed into a URL or command line.
     * <p>
     * Examples:
     * - "192.0.2.1" → true
     * - "db-1.internal" → true
     * - "10.0.0.1/admin?x=1" → false
     */
    public static boolean isSafeHost(String address) {
        return address != null && !address.isBlank() && SAFE_HOST.matcher(address).matches();
    }

    /**
     * Host part for a URL, bracketing IPv6 literals.
     */
    public static String urlHost(String address) {
        if (address != null && address.contains(":") && !address.startsWith("[")) {
            return "[" + address + "]";
        }
        return address;
    }

    /**
     * Patroni member name of a node, e.g. "192.0.2.1" → "pg192_0_2_1".
     */
    public static String patroniMemberName(String address) {
        return "pg" + sanitize(address);
    }

    private static String sanitize(String address) {
        return address.replace('.', '_').replace(':', '_');
    }
}
