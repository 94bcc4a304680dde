package de.bsommerfeld.pluginmarket.market;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.boot.BootRootProvider;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.domain.LocalSnapshot;
import de.bsommerfeld.pluginmarket.core.domain.OperationKind;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.TaskKey;
import de.bsommerfeld.pluginmarket.core.error.MarketException;
import de.bsommerfeld.pluginmarket.core.error.PluginIoException;
import de.bsommerfeld.pluginmarket.core.error.PluginNotFoundException;
import de.bsommerfeld.pluginmarket.core.event.ApplicationEventBus;
import de.bsommerfeld.pluginmarket.core.event.MarketEvents.LocalPluginsChangedEvent;
import de.bsommerfeld.pluginmarket.core.event.MarketEvents.OperationFinishedEvent;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.local.FilenameCodec;
import de.bsommerfeld.pluginmarket.local.LocalPluginScanner;
import de.bsommerfeld.pluginmarket.remote.download.DownloadEngine;
import de.bsommerfeld.pluginmarket.remote.download.DownloadProgress;
import de.bsommerfeld.pluginmarket.remote.download.ProgressTracker;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs install, update, enable, disable, delete and download operations in
 * the background.
 *
 * <h3>Task keys</h3>
 * Every operation except delete is registered in the {@link TaskRegistry}
 * under its plugin identity and {@link OperationKind}. Starting an operation
 * whose key is already registered does nothing and returns
 * {@link Optional#empty()}. Operations of different kinds on the same plugin
 * are not serialized against each other.
 *
 * <h3>Completion order</h3>
 * Filesystem change, then rescan of the plugin directory, then removal of
 * the task entry, then {@link OperationFinishedEvent}, then completion of
 * the returned future. A caller woken by the future therefore never sees
 * the task as still running.
 *
 * <h3>Failures</h3>
 * A failed operation is logged at WARN, reported through the event with
 * {@code success=false} and completes its future exceptionally with the
 * {@link MarketException}. Operations on the plugin directory rescan it on
 * failure too, so the registry matches the disk once the task entry is gone.
 * Nothing is retried or rolled back; in particular an update whose download
 * fails leaves the plugin uninstalled. The task entry is removed even when
 * the operation dies with an {@link Error}.
 */
@Singleton
public class LifecycleOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(LifecycleOrchestrator.class);

    private final ModeProfile mode;
    private final PluginRegistry registry;
    private final TaskRegistry tasks;
    private final LocalPluginScanner scanner;
    private final DownloadEngine downloads;
    private final BootRootProvider bootRoot;
    private final MarketConfig config;
    private final WorkerPool pool;
    private final ApplicationEventBus eventBus;

    @Inject
    public LifecycleOrchestrator(ModeProfile mode, PluginRegistry registry, TaskRegistry tasks,
            LocalPluginScanner scanner, DownloadEngine downloads, BootRootProvider bootRoot,
            MarketConfig config, WorkerPool pool, ApplicationEventBus eventBus) {
        this.mode = mode;
        this.registry = registry;
        this.tasks = tasks;
        this.scanner = scanner;
        this.downloads = downloads;
        this.bootRoot = bootRoot;
        this.config = config;
        this.pool = pool;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Operations
    // =====================================================================

    /**
     * Downloads a catalog entry into the plugin directory under its
     * canonical filename.
     */
    public Optional<CompletableFuture<Void>> install(Plugin remote) {
        return submit(TaskKey.of(remote, OperationKind.INSTALL), true, tracker -> {
            Path target = pluginDirectory().resolve(FilenameCodec.encode(remote, mode));
            downloads.download(remote.link(), target, tracker);
            rescan();
            return null;
        });
    }

    /**
     * Replaces the installed file of the plugin with the catalog version.
     * The old file is deleted before the download starts; if it cannot be
     * deleted the update is aborted so two versions are never installed side
     * by side.
     */
    public Optional<CompletableFuture<Void>> update(Plugin remote) {
        return submit(TaskKey.of(remote, OperationKind.UPDATE), true, tracker -> {
            Path dir = pluginDirectory();
            Plugin installed = registry.findLocalByIdentity(remote.identity())
                    .orElseThrow(() -> new PluginNotFoundException(remote.identity() + " is not installed"));

            deleteFile(dir.resolve(installed.file()));
            downloads.download(remote.link(), dir.resolve(FilenameCodec.encode(remote, mode)), tracker);
            rescan();
            return null;
        });
    }

    /**
     * Updates an installed plugin from the management view, where only the
     * local entry is known.
     *
     * @throws PluginNotFoundException if the catalog has no entry with the
     *                                 plugin's identity
     */
    public Optional<CompletableFuture<Void>> updateInstalled(Plugin local) throws PluginNotFoundException {
        Plugin remote = registry.findRemoteByIdentity(local.identity())
                .orElseThrow(() -> new PluginNotFoundException("No catalog entry for " + local.identity()));
        return update(remote);
    }

    public Optional<CompletableFuture<Void>> enable(Plugin local) {
        return submit(TaskKey.of(local, OperationKind.ENABLE), true, tracker -> {
            rename(local, FilenameCodec.toEnabledName(local.file(), mode));
            rescan();
            return null;
        });
    }

    public Optional<CompletableFuture<Void>> disable(Plugin local) {
        return submit(TaskKey.of(local, OperationKind.DISABLE), true, tracker -> {
            rename(local, FilenameCodec.toDisabledName(local.file(), mode));
            rescan();
            return null;
        });
    }

    /**
     * Deletes the plugin's file. Not tracked as a task and not followed by a
     * rescan; callers refresh when they need the new state.
     */
    public CompletableFuture<Void> delete(Plugin local) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            pool.executor().execute(() -> {
                try {
                    deleteFile(pluginDirectory().resolve(local.file()));
                    future.complete(null);
                } catch (MarketException | RuntimeException e) {
                    LOG.warn("Failed to delete {}: {}", local.file(), e.getMessage());
                    future.completeExceptionally(e);
                } catch (Error e) {
                    future.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Downloads a catalog entry to an arbitrary directory without touching
     * the plugin directory.
     *
     * @param directory target directory, or {@code null} for the configured
     *                  default download path
     * @return future completing with the written file
     */
    public Optional<CompletableFuture<Path>> download(Plugin remote, Path directory) {
        return submit(TaskKey.of(remote, OperationKind.DOWNLOAD), false, tracker -> {
            Path target = downloadDirectory(directory).resolve(FilenameCodec.encode(remote, mode));
            downloads.download(remote.link(), target, tracker);
            return target;
        });
    }

    /**
     * Rescans the plugin directory and replaces the registry's local
     * snapshot.
     */
    public LocalSnapshot rescan() throws PluginNotFoundException, PluginIoException {
        LocalSnapshot snapshot = scanner.scan(pluginDirectory(), mode);
        registry.replaceLocal(snapshot);
        eventBus.post(new LocalPluginsChangedEvent(snapshot.enabled().size(), snapshot.disabled().size()));
        return snapshot;
    }

    // =====================================================================
    // Task queries
    // =====================================================================

    public boolean isRunning(Plugin plugin, OperationKind kind) {
        return tasks.isRunning(TaskKey.of(plugin, kind));
    }

    public Optional<DownloadProgress> progress(Plugin plugin, OperationKind kind) {
        return tasks.progress(TaskKey.of(plugin, kind));
    }

    // =====================================================================
    // Internals
    // =====================================================================

    @FunctionalInterface
    private interface Operation<T> {
        T run(ProgressTracker tracker) throws MarketException;
    }

    /**
     * @param touchesPluginDirectory whether a failed run must rescan the
     *                               plugin directory before the task entry
     *                               is removed
     */
    private <T> Optional<CompletableFuture<T>> submit(TaskKey key, boolean touchesPluginDirectory,
            Operation<T> operation) {
        ProgressTracker tracker = new ProgressTracker();
        if (!tasks.tryStart(key, tracker)) {
            LOG.debug("Ignoring {}: already running", key);
            return Optional.empty();
        }

        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            pool.executor().execute(() -> run(key, touchesPluginDirectory, tracker, operation, future));
        } catch (RejectedExecutionException e) {
            tasks.finish(key);
            future.completeExceptionally(e);
        }
        return Optional.of(future);
    }

    private <T> void run(TaskKey key, boolean touchesPluginDirectory, ProgressTracker tracker,
            Operation<T> operation, CompletableFuture<T> future) {
        LOG.info("Starting {}", key);
        T result = null;
        Throwable failure = null;
        try {
            result = operation.run(tracker);
        } catch (MarketException | RuntimeException e) {
            LOG.warn("{} failed: {}", key, e.getMessage());
            failure = e;
            if (touchesPluginDirectory) {
                rescanAfterFailure(key);
            }
        } catch (Error e) {
            LOG.error("{} aborted", key, e);
            failure = e;
        } finally {
            tasks.finish(key);
        }

        if (failure == null) {
            LOG.info("{} finished", key);
            eventBus.post(OperationFinishedEvent.succeeded(key));
            future.complete(result);
            return;
        }
        eventBus.post(OperationFinishedEvent.failed(key, failure.getMessage()));
        future.completeExceptionally(failure);
        if (failure instanceof Error) {
            throw (Error) failure;
        }
    }

    private void rescanAfterFailure(TaskKey key) {
        try {
            rescan();
        } catch (MarketException | RuntimeException e) {
            LOG.warn("Rescan after failed {} did not complete: {}", key, e.getMessage());
        }
    }

    private Path pluginDirectory() throws PluginNotFoundException {
        if (mode.isSelector()) {
            throw new PluginNotFoundException("The source selector has no plugin directory");
        }
        Path root = bootRoot.currentBootRoot()
                .orElseThrow(() -> new PluginNotFoundException("No boot drive selected"));
        return mode.pluginDirectory(root);
    }

    private Path downloadDirectory(Path requested) throws PluginNotFoundException {
        if (requested != null) {
            return requested;
        }
        String configured = config.getDefaultDownloadPath();
        if (configured.isEmpty()) {
            throw new PluginNotFoundException("No download directory given and none configured");
        }
        return Paths.get(configured);
    }

    private void rename(Plugin local, String newName) throws MarketException {
        Path dir = pluginDirectory();
        Path source = dir.resolve(local.file());
        if (!Files.exists(source)) {
            throw new PluginNotFoundException("File does not exist: " + source);
        }
        if (newName.equals(local.file())) {
            LOG.warn("{} has no {} suffix to swap, leaving it as is", local.file(), mode.serverName());
            return;
        }
        try {
            Files.move(source, dir.resolve(newName));
            LOG.debug("Renamed {} to {}", local.file(), newName);
        } catch (IOException e) {
            throw new PluginIoException("Cannot rename " + local.file() + " to " + newName, e);
        }
    }

    private static void deleteFile(Path file) throws PluginNotFoundException, PluginIoException {
        try {
            Files.delete(file);
            LOG.debug("Deleted {}", file);
        } catch (NoSuchFileException e) {
            throw new PluginNotFoundException("File does not exist: " + file);
        } catch (IOException e) {
            throw new PluginIoException("Cannot delete " + file, e);
        }
    }
}
