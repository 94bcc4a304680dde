package de.bsommerfeld.pluginmarket.remote.download;

import de.bsommerfeld.pluginmarket.core.util.SizeFormatter;

import java.util.Locale;

/**
 * Snapshot of a running transfer.
 *
 * @param bytesReceived bytes written so far
 * @param totalBytes    expected size, {@code -1} when the server sent no
 *                      Content-Length
 * @param mibPerSecond  average throughput since the transfer started
 */
public record DownloadProgress(long bytesReceived, long totalBytes, double mibPerSecond) {

    public static final DownloadProgress NOT_STARTED = new DownloadProgress(0, -1, 0);

    public boolean isTotalKnown() {
        return totalBytes >= 0;
    }

    /** Completed fraction in {@code [0, 1]}, or {@code -1} when the total is unknown. */
    public double fraction() {
        if (!isTotalKnown()) {
            return -1;
        }
        if (totalBytes == 0) {
            return 1;
        }
        return Math.min(1.0, (double) bytesReceived / totalBytes);
    }

    /** E.g. {@code "1.50 MB / 3.00 MB (2.10 MiB/s)"}. */
    public String describe() {
        return String.format(Locale.ROOT, "%s / %s (%.2f MiB/s)",
                SizeFormatter.format(bytesReceived), SizeFormatter.format(totalBytes), mibPerSecond);
    }
}
