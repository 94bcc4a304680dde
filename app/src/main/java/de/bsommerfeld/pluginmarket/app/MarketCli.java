package de.bsommerfeld.pluginmarket.app;

import de.bsommerfeld.pluginmarket.core.domain.LocalSnapshot;
import de.bsommerfeld.pluginmarket.core.domain.OperationKind;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginCategory;
import de.bsommerfeld.pluginmarket.core.domain.PluginIdentity;
import de.bsommerfeld.pluginmarket.core.error.MarketException;
import de.bsommerfeld.pluginmarket.core.error.PluginNotFoundException;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.market.LifecycleOrchestrator;
import de.bsommerfeld.pluginmarket.market.MarketSession;
import de.bsommerfeld.pluginmarket.market.PluginRegistry;
import de.bsommerfeld.pluginmarket.market.SourceSelector;
import de.bsommerfeld.pluginmarket.remote.download.DownloadProgress;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one {@link CommandLine} against the injected market components
 * and prints the result.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_OK}: success</li>
 * <li>{@value #EXIT_FAILURE}: usage error or failed operation</li>
 * <li>{@value #EXIT_UNAVAILABLE}: server unreachable or catalog not loaded</li>
 * </ul>
 */
public class MarketCli {

    private static final Logger LOG = LoggerFactory.getLogger(MarketCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_UNAVAILABLE = 2;

    private static final long PROGRESS_INTERVAL_MILLIS = 500;

    private final ModeProfile mode;
    private final MarketSession session;
    private final PluginRegistry registry;
    private final LifecycleOrchestrator orchestrator;
    private final SourceSelector selector;
    private PrintStream out = System.out;

    @Inject
    public MarketCli(ModeProfile mode, MarketSession session, PluginRegistry registry,
            LifecycleOrchestrator orchestrator, SourceSelector selector) {
        this.mode = mode;
        this.session = session;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.selector = selector;
    }

    /** Redirects output, for embedding and tests. */
    public MarketCli withOutput(PrintStream stream) {
        this.out = stream;
        return this;
    }

    public int run(CommandLine line) {
        try {
            if (mode.isSelector()) {
                return selectSource();
            }
            return switch (line.command()) {
                case "installed" -> installed();
                case "enable" -> enable(line.argument(0, "file"));
                case "disable" -> disable(line.argument(0, "file"));
                case "delete" -> delete(line.argument(0, "file"));
                case "categories", "list", "search", "status", "install", "update", "download" -> withCatalog(line);
                default -> usage("Unknown command " + line.command());
            };
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        } catch (MarketException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return EXIT_FAILURE;
        }
    }

    // =====================================================================
    // Catalog commands
    // =====================================================================

    private int withCatalog(CommandLine line) throws MarketException, InterruptedException {
        if (!awaitCatalog()) {
            out.println(mode.serverName() + ": " + session.catalogStatus().message());
            return EXIT_UNAVAILABLE;
        }
        return switch (line.command()) {
            case "categories" -> categories();
            case "list" -> list(line.optionalArgument(0));
            case "search" -> search(line.argument(0, "keyword"));
            default -> remoteCommand(line, remote(line));
        };
    }

    private int remoteCommand(CommandLine line, Plugin remote) throws InterruptedException {
        return switch (line.command()) {
            case "status" -> status(remote);
            case "install" -> await(orchestrator.install(remote), remote, OperationKind.INSTALL);
            case "update" -> await(orchestrator.update(remote), remote, OperationKind.UPDATE);
            case "download" -> {
                Path directory = line.optionalArgument(2).map(Paths::get).orElse(null);
                yield await(orchestrator.download(remote, directory), remote, OperationKind.DOWNLOAD);
            }
            default -> usage("Unknown command " + line.command());
        };
    }

    private boolean awaitCatalog() throws InterruptedException {
        try {
            return session.start().get();
        } catch (ExecutionException e) {
            LOG.warn("Startup failed", e.getCause());
            return false;
        }
    }

    private int categories() {
        for (PluginCategory category : registry.getCategories()) {
            out.printf("%s (%d)%n", category.label(), category.plugins().size());
        }
        return EXIT_OK;
    }

    private int list(Optional<String> label) {
        List<Plugin> plugins = label.map(registry::categoryPlugins)
                .orElseGet(() -> session.defaultCategory().map(PluginCategory::plugins).orElse(List.of()));
        plugins.forEach(this::printRemote);
        return EXIT_OK;
    }

    private int search(String keyword) {
        List<Plugin> results = registry.search(keyword);
        results.forEach(this::printRemote);
        if (results.isEmpty()) {
            out.println("No plugins match '" + keyword + "'");
        }
        return EXIT_OK;
    }

    private int status(Plugin remote) {
        out.println(remote.name() + " " + remote.version() + ": " + registry.statusOf(remote));
        return EXIT_OK;
    }

    private Plugin remote(CommandLine line) throws PluginNotFoundException {
        PluginIdentity identity = new PluginIdentity(line.argument(0, "name"), line.argument(1, "author"));
        return registry.findRemoteByIdentity(identity)
                .orElseThrow(() -> new PluginNotFoundException("No catalog entry for " + identity));
    }

    // =====================================================================
    // Local commands
    // =====================================================================

    private int installed() throws MarketException {
        LocalSnapshot snapshot = session.refreshLocal();
        out.println("Enabled:");
        snapshot.enabled().forEach(this::printLocal);
        out.println("Disabled:");
        snapshot.disabled().forEach(this::printLocal);
        return EXIT_OK;
    }

    private int enable(String file) throws MarketException, InterruptedException {
        Plugin local = local(file);
        return await(orchestrator.enable(local), local, OperationKind.ENABLE);
    }

    private int disable(String file) throws MarketException, InterruptedException {
        Plugin local = local(file);
        return await(orchestrator.disable(local), local, OperationKind.DISABLE);
    }

    private int delete(String file) throws MarketException, InterruptedException {
        Plugin local = local(file);
        try {
            orchestrator.delete(local).get();
            out.println("Deleted " + file);
            return EXIT_OK;
        } catch (ExecutionException e) {
            out.println("Error: " + e.getCause().getMessage());
            return EXIT_FAILURE;
        }
    }

    private Plugin local(String file) throws MarketException {
        session.refreshLocal();
        return registry.findLocalByFile(file)
                .orElseThrow(() -> new PluginNotFoundException("No local plugin " + file));
    }

    // =====================================================================
    // Source selection
    // =====================================================================

    private int selectSource() throws InterruptedException {
        Optional<CompletableFuture<Map<ModeProfile, Boolean>>> check = selector.checkAvailability();
        if (check.isEmpty()) {
            out.println("A check is already running");
            return EXIT_FAILURE;
        }
        Map<ModeProfile, Boolean> availability;
        try {
            availability = check.get().get();
        } catch (ExecutionException e) {
            out.println("Error: " + e.getCause().getMessage());
            return EXIT_FAILURE;
        }

        boolean any = false;
        for (Map.Entry<ModeProfile, Boolean> entry : availability.entrySet()) {
            ModeProfile candidate = entry.getKey();
            boolean available = entry.getValue();
            any |= available;
            out.printf("%-10s %-12s %s%n", candidate.serverName(), available ? "available" : "unavailable",
                    String.join(" ", SourceSelector.launchArguments(candidate)));
        }
        return any ? EXIT_OK : EXIT_UNAVAILABLE;
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private <T> int await(Optional<CompletableFuture<T>> task, Plugin plugin, OperationKind kind)
            throws InterruptedException {
        if (task.isEmpty()) {
            out.println(plugin.name() + ": " + kind.name().toLowerCase(Locale.ROOT) + " already running");
            return EXIT_FAILURE;
        }
        CompletableFuture<T> future = task.get();
        while (true) {
            try {
                T result = future.get(PROGRESS_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                out.println(plugin.name() + ": done" + (result != null ? " (" + result + ")" : ""));
                return EXIT_OK;
            } catch (TimeoutException e) {
                orchestrator.progress(plugin, kind)
                        .map(DownloadProgress::describe)
                        .ifPresent(progress -> out.println(plugin.name() + ": " + progress));
            } catch (ExecutionException e) {
                out.println("Error: " + e.getCause().getMessage());
                return EXIT_FAILURE;
            }
        }
    }

    private int usage(String message) {
        if (message != null) {
            out.println(message);
        }
        out.println(CommandLine.USAGE);
        return EXIT_FAILURE;
    }

    private void printRemote(Plugin plugin) {
        out.printf("%-24s %-12s %-16s %-10s %s%n", plugin.name(), plugin.version(), plugin.author(),
                plugin.size(), registry.statusOf(plugin));
    }

    private void printLocal(Plugin plugin) {
        out.printf("  %-24s %-12s %-16s %-10s %s%n", plugin.name(), plugin.version(), plugin.author(),
                plugin.size(), plugin.file());
    }
}
