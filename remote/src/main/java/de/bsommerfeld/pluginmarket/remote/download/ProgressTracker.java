package de.bsommerfeld.pluginmarket.remote.download;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress listener that keeps the latest {@link DownloadProgress} for
 * readers on other threads. Reads never block the transfer.
 */
public final class ProgressTracker implements DownloadProgressListener {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    private static final double BYTES_PER_MIB = 1024d * 1024d;

    private final AtomicReference<DownloadProgress> current = new AtomicReference<>(DownloadProgress.NOT_STARTED);

    @Override
    public void onProgress(long bytesRead, long totalBytes, long elapsedNanos) {
        current.set(new DownloadProgress(bytesRead, totalBytes, throughput(bytesRead, elapsedNanos)));
    }

    public DownloadProgress current() {
        return current.get();
    }

    static double throughput(long bytes, long elapsedNanos) {
        if (elapsedNanos <= 0) {
            return 0;
        }
        return bytes / (elapsedNanos / NANOS_PER_SECOND) / BYTES_PER_MIB;
    }
}
