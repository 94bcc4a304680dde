package de.bsommerfeld.pluginmarket.market;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.domain.LocalSnapshot;
import de.bsommerfeld.pluginmarket.core.domain.PluginCategory;
import de.bsommerfeld.pluginmarket.core.error.MarketException;
import de.bsommerfeld.pluginmarket.core.error.PluginIoException;
import de.bsommerfeld.pluginmarket.core.error.PluginNotFoundException;
import de.bsommerfeld.pluginmarket.core.event.ApplicationEventBus;
import de.bsommerfeld.pluginmarket.core.event.MarketEvents.CatalogLoadFailedEvent;
import de.bsommerfeld.pluginmarket.core.event.MarketEvents.CatalogLoadedEvent;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.remote.catalog.ConnectivityProbe;
import de.bsommerfeld.pluginmarket.remote.catalog.RemoteCatalogFetcher;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Startup sequence of a market window: connectivity check, local scan and
 * catalog load.
 *
 * <p>
 * The outcome of the last catalog load is kept as a {@link CatalogStatus}.
 * A failed load leaves the registry with an empty catalog and the status
 * {@link CatalogState#FAILED} until a later load succeeds.
 */
@Singleton
public class MarketSession {

    private static final Logger LOG = LoggerFactory.getLogger(MarketSession.class);

    /** Label of the category shown first when present. */
    public static final String RECOMMENDED_CATEGORY = "推荐";
    public static final String UNREACHABLE_MESSAGE = "无法连接到服务器";

    public enum CatalogState {
        LOADING,
        READY,
        FAILED
    }

    /** @param message failure description, {@code null} unless FAILED */
    public record CatalogStatus(CatalogState state, String message) {
    }

    private final ModeProfile mode;
    private final RemoteCatalogFetcher fetcher;
    private final ConnectivityProbe probe;
    private final PluginRegistry registry;
    private final LifecycleOrchestrator orchestrator;
    private final WorkerPool pool;
    private final ApplicationEventBus eventBus;

    private final AtomicReference<CatalogStatus> status =
            new AtomicReference<>(new CatalogStatus(CatalogState.LOADING, null));

    @Inject
    public MarketSession(ModeProfile mode, RemoteCatalogFetcher fetcher, ConnectivityProbe probe,
            PluginRegistry registry, LifecycleOrchestrator orchestrator, WorkerPool pool,
            ApplicationEventBus eventBus) {
        this.mode = mode;
        this.fetcher = fetcher;
        this.probe = probe;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.pool = pool;
        this.eventBus = eventBus;
    }

    /**
     * Runs the startup sequence on the worker pool.
     *
     * @return future completing with {@code true} if the catalog is ready
     */
    public CompletableFuture<Boolean> start() {
        return CompletableFuture.supplyAsync(() -> {
            if (!probe.probe(mode)) {
                fail(UNREACHABLE_MESSAGE);
                return false;
            }
            try {
                refreshLocal();
            } catch (PluginNotFoundException e) {
                LOG.info("Skipping local scan: {}", e.getMessage());
            } catch (PluginIoException e) {
                LOG.warn("Local scan failed: {}", e.getMessage());
            }
            return loadCatalog();
        }, pool.executor());
    }

    /**
     * Fetches the catalog and installs it into the registry. Blocks the
     * calling thread.
     *
     * @return {@code true} on success
     */
    public boolean loadCatalog() {
        status.set(new CatalogStatus(CatalogState.LOADING, null));
        try {
            List<PluginCategory> categories = fetcher.fetch(mode);
            registry.replaceCatalog(categories);
            status.set(new CatalogStatus(CatalogState.READY, null));
            eventBus.post(new CatalogLoadedEvent(mode, categories.size()));
            return true;
        } catch (MarketException e) {
            LOG.warn("Failed to load {} catalog: {}", mode.serverName(), e.getMessage());
            fail(e.getMessage());
            return false;
        }
    }

    /** Rescans the plugin directory of the current boot drive. */
    public LocalSnapshot refreshLocal() throws PluginNotFoundException, PluginIoException {
        return orchestrator.rescan();
    }

    /**
     * Category to show first: the recommended one if the catalog has it,
     * otherwise the first category.
     */
    public Optional<PluginCategory> defaultCategory() {
        List<PluginCategory> categories = registry.getCategories();
        for (PluginCategory category : categories) {
            if (RECOMMENDED_CATEGORY.equals(category.label())) {
                return Optional.of(category);
            }
        }
        return categories.isEmpty() ? Optional.empty() : Optional.of(categories.get(0));
    }

    public CatalogStatus catalogStatus() {
        return status.get();
    }

    public ModeProfile mode() {
        return mode;
    }

    private void fail(String message) {
        registry.replaceCatalog(List.of());
        status.set(new CatalogStatus(CatalogState.FAILED, message));
        eventBus.post(new CatalogLoadFailedEvent(mode, message));
    }
}
