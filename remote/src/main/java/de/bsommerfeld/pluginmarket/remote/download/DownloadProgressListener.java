package de.bsommerfeld.pluginmarket.remote.download;

/**
 * Callback for tracking download progress.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    /** Listener that ignores all updates. */
    DownloadProgressListener NONE = (bytesRead, totalBytes, elapsedNanos) -> {
    };

    /**
     * Called after every chunk written to disk.
     *
     * @param bytesRead    bytes transferred so far
     * @param totalBytes   total expected size, or -1 if unknown
     * @param elapsedNanos time since the response headers arrived
     */
    void onProgress(long bytesRead, long totalBytes, long elapsedNanos);
}
