package de.bsommerfeld.pluginmarket.market;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.remote.catalog.ConnectivityProbe;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Checks which plugin sources are reachable so the user can pick one.
 *
 * <p>
 * All ecosystems are probed concurrently. While a check runs,
 * {@link #availability(ModeProfile)} is empty for modes without a result
 * yet; a second check requested meanwhile is ignored.
 */
@Singleton
public class SourceSelector {

    private static final Logger LOG = LoggerFactory.getLogger(SourceSelector.class);

    private final ConnectivityProbe probe;
    private final WorkerPool pool;
    private final Map<ModeProfile, Boolean> results = new ConcurrentHashMap<>();
    private final AtomicBoolean checking = new AtomicBoolean();

    @Inject
    public SourceSelector(ConnectivityProbe probe, WorkerPool pool) {
        this.probe = probe;
        this.pool = pool;
    }

    /**
     * Probes every ecosystem.
     *
     * @return future with the availability per mode, in display order, or
     *         empty if a check is already running
     */
    public Optional<CompletableFuture<Map<ModeProfile, Boolean>>> checkAvailability() {
        if (!checking.compareAndSet(false, true)) {
            return Optional.empty();
        }
        results.clear();

        List<CompletableFuture<Void>> probes = new ArrayList<>();
        for (ModeProfile mode : ModeProfile.ecosystems()) {
            probes.add(CompletableFuture.runAsync(() -> {
                boolean available = probe.probe(mode);
                LOG.info("{} is {}", mode.serverName(), available ? "available" : "unavailable");
                results.put(mode, available);
            }, pool.executor()));
        }

        CompletableFuture<Map<ModeProfile, Boolean>> all = CompletableFuture
                .allOf(probes.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> {
                    checking.set(false);
                    Map<ModeProfile, Boolean> snapshot = new EnumMap<>(ModeProfile.class);
                    for (ModeProfile mode : ModeProfile.ecosystems()) {
                        snapshot.put(mode, results.getOrDefault(mode, false));
                    }
                    return snapshot;
                });
        return Optional.of(all);
    }

    /** Result of the latest check for {@code mode}, empty while unknown. */
    public Optional<Boolean> availability(ModeProfile mode) {
        return Optional.ofNullable(results.get(mode));
    }

    public boolean isChecking() {
        return checking.get();
    }

    /**
     * Command-line arguments that start the market for {@code mode}.
     *
     * @throws IllegalArgumentException for the selector itself
     */
    public static List<String> launchArguments(ModeProfile mode) {
        if (mode.isSelector()) {
            throw new IllegalArgumentException("Cannot launch the selector from itself");
        }
        return mode.flag().isEmpty() ? List.of() : List.of(mode.flag());
    }
}
