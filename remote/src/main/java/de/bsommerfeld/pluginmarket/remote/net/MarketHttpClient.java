package de.bsommerfeld.pluginmarket.remote.net;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.error.NetworkException;
import de.bsommerfeld.pluginmarket.core.error.ProtocolException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared HTTP access for catalog requests, connectivity probes and plugin
 * downloads.
 *
 * <h3>Defaults</h3>
 * Redirects are followed (download links point at CDNs), connecting times
 * out after {@link #CONNECT_TIMEOUT}, and catalog requests after
 * {@link #REQUEST_TIMEOUT}. Streamed downloads carry no request timeout so
 * large files are not cut off.
 *
 * <h3>Errors</h3>
 * Transport failures become {@link NetworkException}, statuses outside 2xx
 * become {@link ProtocolException} with reason
 * {@link ProtocolException.Reason#HTTP_STATUS}.
 */
@Singleton
public class MarketHttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(MarketHttpClient.class);

    public static final String USER_AGENT = "PE-Plugin-Market/1.0";
    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;

    @Inject
    public MarketHttpClient(MarketConfig config) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .executor(newExecutor(config.getDownloadThreads()))
                .build());
    }

    MarketHttpClient(HttpClient client) {
        this.client = client;
    }

    /** Fetches a URL as UTF-8 text using the default request timeout. */
    public String getString(String url) throws NetworkException, ProtocolException {
        return getString(url, REQUEST_TIMEOUT);
    }

    public String getString(String url, Duration timeout) throws NetworkException, ProtocolException {
        HttpRequest request = newRequest(url).timeout(timeout).build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), url);
        validateStatus(response.statusCode(), url);
        return response.body();
    }

    /**
     * Opens a streamed GET. The caller owns the returned body stream and must
     * close it.
     */
    public HttpResponse<InputStream> openStream(String url) throws NetworkException, ProtocolException {
        HttpRequest request = newRequest(url).build();
        HttpResponse<InputStream> response = send(request, HttpResponse.BodyHandlers.ofInputStream(), url);
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            closeQuietly(response.body(), url);
            validateStatus(response.statusCode(), url);
        }
        return response;
    }

    private HttpRequest.Builder newRequest(String url) throws NetworkException {
        try {
            return HttpRequest.newBuilder(URI.create(url))
                    .header("User-Agent", USER_AGENT)
                    .GET();
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Invalid URL: " + url, e);
        }
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String url)
            throws NetworkException {
        try {
            LOG.debug("GET {}", url);
            return client.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Request interrupted: " + url, e);
        } catch (IOException e) {
            throw new NetworkException("Request failed: " + url + " (" + e.getMessage() + ")", e);
        }
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    static void validateStatus(int status, String url) throws ProtocolException {
        if (status < 200 || status >= 300) {
            throw new ProtocolException(status, url);
        }
    }

    private static void closeQuietly(InputStream in, String url) {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("Failed to close response body of {}", url, e);
        }
    }

    static ExecutorService newExecutor(int threads) {
        return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setNameFormat("market-http-%d")
                .setDaemon(true)
                .build());
    }
}
