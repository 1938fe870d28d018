package de.bsommerfeld.xivpatch.core.util;

import java.util.Locale;

/**
 * Formats byte sizes and transfer durations into human-readable strings.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteFormatter() {}

    /**
     * Formats a byte count, e.g. "14.3 MB". Negative values are unknown sizes.
     */
    public static String format(long bytes) {
        if (bytes < 0) return "? B";

        double value = bytes;
        int unitIdx = 0;
        while (value >= 1024 && unitIdx < UNITS.length - 1) {
            value /= 1024;
            unitIdx++;
        }

        if (unitIdx == 0) return bytes + " B";
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unitIdx]);
    }

    /** Formats a throughput, e.g. "3.2 MB/s". */
    public static String formatRate(long bytesPerSecond) {
        return format(bytesPerSecond) + "/s";
    }

    /** Formats remaining seconds as "42s", "3m 5s" or "2h 10m". */
    public static String formatDuration(long seconds) {
        if (seconds < 0) return "?";
        if (seconds < 60) return seconds + "s";
        if (seconds < 3600) return (seconds / 60) + "m " + (seconds % 60) + "s";
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}
