package de.bsommerfeld.pluginmarket.remote.catalog;

import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.remote.net.MarketHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityProbeTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger emptyHits = new AtomicInteger();
    private final AtomicInteger flakyHits = new AtomicInteger();
    private ConnectivityProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/ok", exchange -> reply(exchange, 200, "ok"));
        server.createContext("/empty", exchange -> {
            emptyHits.incrementAndGet();
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.createContext("/flaky", exchange -> {
            if (flakyHits.incrementAndGet() < 2) {
                reply(exchange, 500, "busy");
            } else {
                reply(exchange, 200, "ok");
            }
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        probe = new ConnectivityProbe(new MarketHttpClient(new MarketConfig()), 3, Duration.ofSeconds(2), Duration.ZERO);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void probe_shouldSucceedOnNonEmptyBody() {
        assertTrue(probe.probe(baseUrl + "/ok"));
    }

    @Test
    void probe_shouldRetryAndGiveUpOnEmptyBody() {
        assertFalse(probe.probe(baseUrl + "/empty"));
        assertEquals(3, emptyHits.get());
    }

    @Test
    void probe_shouldRecoverOnRetry() {
        assertTrue(probe.probe(baseUrl + "/flaky"));
        assertEquals(2, flakyHits.get());
    }

    @Test
    void probe_shouldReturnFalseForMissingUrl() {
        assertFalse(probe.probe(ModeProfile.SELECT));
        assertFalse(probe.probe((String) null));
    }

    @Test
    void constructor_shouldReadTimingsFromConfig() {
        MarketConfig config = new MarketConfig();
        config.setProbeAttempts(1);
        config.setProbeRetryDelaySeconds(0);
        ConnectivityProbe configured = new ConnectivityProbe(new MarketHttpClient(config), config);

        assertFalse(configured.probe(baseUrl + "/empty"));
        assertEquals(1, emptyHits.get());
    }

    private static void reply(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
