package de.bsommerfeld.pluginmarket.core.util;

import java.util.Locale;

/**
 * Formats byte counts into the size strings shown next to plugins
 * (e.g. {@code "14.30 MB"}).
 *
 * <p>
 * Output is locale-independent: always a dot as decimal separator and two
 * fraction digits for every unit above bytes. Values are capped at GB.
 */
public final class SizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    /** Returned for negative input, e.g. an unknown Content-Length. */
    public static final String UNKNOWN = "? B";

    private SizeFormatter() {
    }

    public static String format(long bytes) {
        if (bytes < 0)
            return UNKNOWN;

        double value = bytes;
        int unitIdx = 0;
        while (value >= 1024 && unitIdx < UNITS.length - 1) {
            value /= 1024;
            unitIdx++;
        }

        if (unitIdx == 0)
            return bytes + " B";
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unitIdx]);
    }
}
