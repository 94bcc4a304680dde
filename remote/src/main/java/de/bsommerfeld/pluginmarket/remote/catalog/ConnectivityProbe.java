package de.bsommerfeld.pluginmarket.remote.catalog;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.error.MarketException;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.remote.net.MarketHttpClient;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Checks whether a mode's server is reachable before the catalog is loaded.
 *
 * <p>
 * An attempt succeeds when the endpoint answers 2xx with a non-empty body.
 * Failed attempts are retried up to the configured count with a fixed delay
 * in between; exhausting all attempts is a plain {@code false}, never an
 * exception.
 */
@Singleton
public class ConnectivityProbe {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectivityProbe.class);

    private final MarketHttpClient http;
    private final int attempts;
    private final Duration timeout;
    private final Duration retryDelay;

    @Inject
    public ConnectivityProbe(MarketHttpClient http, MarketConfig config) {
        this(http, config.getProbeAttempts(),
                Duration.ofSeconds(config.getProbeTimeoutSeconds()),
                Duration.ofSeconds(config.getProbeRetryDelaySeconds()));
    }

    public ConnectivityProbe(MarketHttpClient http, int attempts, Duration timeout, Duration retryDelay) {
        this.http = http;
        this.attempts = Math.max(1, attempts);
        this.timeout = timeout;
        this.retryDelay = retryDelay;
    }

    /** Probes the connectivity endpoint of {@code mode}. */
    public boolean probe(ModeProfile mode) {
        return probe(mode.connectivityUrl());
    }

    /**
     * Probes an endpoint. Blocks for up to
     * {@code attempts * timeout + (attempts - 1) * retryDelay}.
     */
    public boolean probe(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String body = http.getString(url, timeout);
                if (!body.isEmpty()) {
                    LOG.debug("Connectivity check of {} succeeded on attempt {}", url, attempt);
                    return true;
                }
                LOG.debug("Connectivity check of {} returned an empty body", url);
            } catch (MarketException e) {
                LOG.debug("Connectivity check {}/{} of {} failed: {}", attempt, attempts, url, e.getMessage());
            }

            if (attempt < attempts && !sleep(retryDelay)) {
                return false;
            }
        }
        LOG.warn("{} unreachable after {} attempts", url, attempts);
        return false;
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
