package de.bsommerfeld.pluginmarket.remote.download;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.error.NetworkException;
import de.bsommerfeld.pluginmarket.core.error.PluginIoException;
import de.bsommerfeld.pluginmarket.core.error.ProtocolException;
import de.bsommerfeld.pluginmarket.remote.net.MarketHttpClient;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Streams a plugin archive from its download link to disk.
 *
 * <p>
 * The body is written straight to the destination, which is what the plugin
 * scanner later picks up. A failed transfer is not resumed and leaves the
 * partial file in place; the next install overwrites it.
 */
@Singleton
public class DownloadEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadEngine.class);

    static final int BUFFER_SIZE = 8192;

    private final MarketHttpClient http;

    @Inject
    public DownloadEngine(MarketHttpClient http) {
        this.http = http;
    }

    /**
     * Downloads {@code url} to {@code destination}, creating parent
     * directories.
     *
     * @return number of bytes written
     * @throws NetworkException  if the server is unreachable or the transfer
     *                           breaks off
     * @throws ProtocolException if the status is outside 2xx
     * @throws PluginIoException if the destination cannot be written
     */
    public long download(String url, Path destination, DownloadProgressListener listener)
            throws NetworkException, ProtocolException, PluginIoException {
        HttpResponse<InputStream> response = http.openStream(url);
        long started = System.nanoTime();
        long totalBytes = response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);

        try (InputStream in = response.body()) {
            createParent(destination);
            long written = transferWithProgress(in, destination, totalBytes, started, listener);
            LOG.info("Downloaded {} ({} bytes) to {}", url, written, destination);
            return written;
        } catch (IOException e) {
            throw new NetworkException("Download of " + url + " failed: " + e.getMessage(), e);
        }
    }

    private static void createParent(Path destination) throws PluginIoException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new PluginIoException("Cannot create directory " + parent, e);
        }
    }

    /**
     * Copies the body in {@value #BUFFER_SIZE} byte chunks, reporting after
     * each one. Read errors surface as {@link IOException}, write errors as
     * {@link PluginIoException}.
     */
    private static long transferWithProgress(InputStream in, Path target, long totalBytes, long started,
            DownloadProgressListener listener) throws IOException, PluginIoException {
        OutputStream out = openTarget(target);
        try (out) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = 0;
            int read;
            listener.onProgress(0, totalBytes, System.nanoTime() - started);
            while ((read = in.read(buffer)) != -1) {
                write(out, buffer, read, target);
                transferred += read;
                listener.onProgress(transferred, totalBytes, System.nanoTime() - started);
            }
            return transferred;
        }
    }

    private static OutputStream openTarget(Path target) throws PluginIoException {
        try {
            return Files.newOutputStream(target);
        } catch (IOException e) {
            throw new PluginIoException("Cannot write " + target, e);
        }
    }

    private static void write(OutputStream out, byte[] buffer, int length, Path target) throws PluginIoException {
        try {
            out.write(buffer, 0, length);
        } catch (IOException e) {
            throw new PluginIoException("Cannot write " + target, e);
        }
    }
}
