package com.pgcluster.ha.util;

import java.util.Locale;

/**
 * Utility class for formatting values for display.
 */
public final class FormatUtils {

    private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

    private FormatUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Convert a byte count to mebibytes.
     */
    public static double toMebibytes(long bytes) {
        return bytes / BYTES_PER_MIB;
    }

    /**
     * Format a mebibyte amount with two decimals (e.g., "3.00MiB").
     * Always uses '.' as decimal separator regardless of the default locale.
     */
    public static String formatMebibytes(double mebibytes) {
        return String.format(Locale.ROOT, "%.2fMiB", mebibytes);
    }
}
