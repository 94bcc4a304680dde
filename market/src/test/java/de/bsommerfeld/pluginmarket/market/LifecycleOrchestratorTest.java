package de.bsommerfeld.pluginmarket.market;

import com.google.common.eventbus.Subscribe;
import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.pluginmarket.core.boot.FixedBootRootProvider;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.domain.OperationKind;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginCategory;
import de.bsommerfeld.pluginmarket.core.domain.PluginStatus;
import de.bsommerfeld.pluginmarket.core.domain.TaskKey;
import de.bsommerfeld.pluginmarket.core.error.PluginNotFoundException;
import de.bsommerfeld.pluginmarket.core.error.ProtocolException;
import de.bsommerfeld.pluginmarket.core.event.ApplicationEventBus;
import de.bsommerfeld.pluginmarket.core.event.MarketEvents.OperationFinishedEvent;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.local.LocalPluginScanner;
import de.bsommerfeld.pluginmarket.remote.download.DownloadEngine;
import de.bsommerfeld.pluginmarket.remote.net.MarketHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LifecycleOrchestratorTest {

    private static final byte[] ARCHIVE = "plugin-archive".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private Path bootRoot;
    private Path downloadDir;

    private HttpServer server;
    private String baseUrl;
    private final CountDownLatch slowGate = new CountDownLatch(1);
    private WorkerPool pool;
    private PluginRegistry registry;
    private TaskRegistry tasks;
    private ApplicationEventBus eventBus;
    private final List<OperationFinishedEvent> finished = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        bootRoot = tempDir.resolve("boot");
        downloadDir = tempDir.resolve("downloads");
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/plugin", exchange -> {
            exchange.sendResponseHeaders(200, ARCHIVE.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(ARCHIVE);
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                slowGate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, ARCHIVE.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(ARCHIVE);
            }
        });
        server.createContext("/gone", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();

        pool = new WorkerPool(Executors.newFixedThreadPool(4));
        registry = new PluginRegistry();
        tasks = new TaskRegistry();
        eventBus = new ApplicationEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void onFinished(OperationFinishedEvent event) {
                finished.add(event);
            }
        });
    }

    @AfterEach
    void tearDown() {
        slowGate.countDown();
        server.stop(0);
        pool.shutdown();
    }

    // -- install --

    @Test
    void install_shouldDownloadUnderCanonicalNameAndRescan() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin remote = remote("Tool", "1.0", "alice", "Fast tool", "/plugin");

        await(orchestrator.install(remote));

        Path installed = bootRoot.resolve("ce-apps").resolve("Tool_1.0_alice_Fast_tool.ce");
        assertArrayEquals(ARCHIVE, Files.readAllBytes(installed));
        assertEquals(PluginStatus.INSTALLED, registry.statusOf(remote));
        assertFalse(orchestrator.isRunning(remote, OperationKind.INSTALL));
        assertTrue(finished.get(0).success());
    }

    @Test
    void install_shouldRejectDuplicateWhileRunning() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.EDGELESS, new MarketConfig());
        Plugin remote = remote("Slow", "1.0", "bob", "", "/slow");

        Optional<CompletableFuture<Void>> first = orchestrator.install(remote);
        Optional<CompletableFuture<Void>> second = orchestrator.install(remote);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertTrue(orchestrator.isRunning(remote, OperationKind.INSTALL));
        assertTrue(orchestrator.progress(remote, OperationKind.INSTALL).isPresent());

        slowGate.countDown();
        await(first);

        assertFalse(orchestrator.isRunning(remote, OperationKind.INSTALL));
        assertTrue(Files.exists(bootRoot.resolve("Edgeless").resolve("Resource").resolve("Slow_1.0_bob.7z")));
    }

    @Test
    void install_shouldClearTaskBeforeFutureCompletes() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin remote = remote("Tool", "1.0", "alice", "", "/plugin");

        CompletableFuture<Boolean> runningAtCompletion = orchestrator.install(remote).orElseThrow()
                .thenApply(ignored -> orchestrator.isRunning(remote, OperationKind.INSTALL));

        assertFalse(runningAtCompletion.get(10, TimeUnit.SECONDS));
    }

    @Test
    void install_shouldFailWithoutBootRoot() {
        LifecycleOrchestrator orchestrator = new LifecycleOrchestrator(ModeProfile.CLOUD_PE, registry, tasks,
                new LocalPluginScanner(), downloadEngine(), new FixedBootRootProvider(null),
                new MarketConfig(), pool, eventBus);
        Plugin remote = remote("Tool", "1.0", "alice", "", "/plugin");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(orchestrator.install(remote)));

        assertInstanceOf(PluginNotFoundException.class, ex.getCause());
        assertFalse(orchestrator.isRunning(remote, OperationKind.INSTALL));
        assertFalse(finished.get(0).success());
    }

    // -- update --

    @Test
    void update_shouldReplaceOldFile() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("ce-apps"));
        Files.writeString(dir.resolve("Tool_1.0_alice_desc.ce"), "old");
        orchestrator.rescan();
        Plugin remote = remote("Tool", "2.0", "alice", "desc", "/plugin");
        assertEquals(PluginStatus.UPDATE_AVAILABLE, registry.statusOf(remote));

        await(orchestrator.update(remote));

        assertFalse(Files.exists(dir.resolve("Tool_1.0_alice_desc.ce")));
        assertTrue(Files.exists(dir.resolve("Tool_2.0_alice_desc.ce")));
        assertEquals(PluginStatus.INSTALLED, registry.statusOf(remote));
    }

    @Test
    void update_shouldLeavePluginRemovedWhenDownloadFails() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("ce-apps"));
        Files.writeString(dir.resolve("Tool_1.0_alice_desc.ce"), "old");
        orchestrator.rescan();
        Plugin remote = remote("Tool", "2.0", "alice", "desc", "/gone");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(orchestrator.update(remote)));

        assertInstanceOf(ProtocolException.class, ex.getCause());
        assertFalse(Files.exists(dir.resolve("Tool_1.0_alice_desc.ce")));
        assertFalse(orchestrator.isRunning(remote, OperationKind.UPDATE));
        assertEquals(PluginStatus.NOT_INSTALLED, registry.statusOf(remote));
        assertTrue(registry.getEnabled().isEmpty());
    }

    @Test
    void update_shouldRejectDuplicateWhileRunning() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("ce-apps"));
        Files.writeString(dir.resolve("Slow_1.0_bob_desc.ce"), "old");
        orchestrator.rescan();
        Plugin remote = remote("Slow", "2.0", "bob", "desc", "/slow");

        Optional<CompletableFuture<Void>> first = orchestrator.update(remote);
        Optional<CompletableFuture<Void>> second = orchestrator.update(remote);

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(Set.of(TaskKey.of(remote, OperationKind.UPDATE)), tasks.runningKeys());

        slowGate.countDown();
        await(first);

        assertTrue(tasks.runningKeys().isEmpty());
        assertTrue(Files.exists(dir.resolve("Slow_2.0_bob_desc.ce")));
    }

    @Test
    void update_shouldFailWhenNothingIsInstalled() {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin remote = remote("Tool", "2.0", "alice", "desc", "/plugin");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(orchestrator.update(remote)));

        assertInstanceOf(PluginNotFoundException.class, ex.getCause());
    }

    @Test
    void updateInstalled_shouldResolveCatalogEntry() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("ce-apps"));
        Files.writeString(dir.resolve("Tool_1.0_alice_desc.ce"), "old");
        Plugin local = orchestrator.rescan().enabled().get(0);
        registry.replaceCatalog(List.of(new PluginCategory("推荐", null,
                List.of(remote("Tool", "1.5", "alice", "desc", "/plugin")))));

        await(orchestrator.updateInstalled(local));

        assertTrue(Files.exists(dir.resolve("Tool_1.5_alice_desc.ce")));
    }

    @Test
    void updateInstalled_shouldThrowWithoutCatalogEntry() {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin local = new Plugin("Tool", "1.0", "alice", "", "1 B", "Tool_1.0_alice_.ce", "");

        assertThrows(PluginNotFoundException.class, () -> orchestrator.updateInstalled(local));
    }

    // -- enable / disable / delete --

    @Test
    void disableThenEnable_shouldSwapSuffixes() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.HOT_PE, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("HotPEModule"));
        Files.writeString(dir.resolve("Mod_alice_1.0.HPM"), "x");
        Plugin enabled = orchestrator.rescan().enabled().get(0);

        await(orchestrator.disable(enabled));

        assertTrue(Files.exists(dir.resolve("Mod_alice_1.0.hpm.off")));
        assertTrue(registry.getEnabled().isEmpty());
        Plugin disabled = registry.getDisabled().get(0);

        await(orchestrator.enable(disabled));

        assertTrue(Files.exists(dir.resolve("Mod_alice_1.0.HPM")));
        assertEquals(1, registry.getEnabled().size());
    }

    @Test
    void enable_shouldFailForMissingFile() {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin ghost = new Plugin("Ghost", "1.0", "x", "", "1 B", "Ghost_1.0_x_.CBK", "");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(orchestrator.enable(ghost)));

        assertInstanceOf(PluginNotFoundException.class, ex.getCause());
    }

    @Test
    void delete_shouldRemoveFileWithoutRescan() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.EDGELESS, new MarketConfig());
        Path dir = Files.createDirectories(bootRoot.resolve("Edgeless").resolve("Resource"));
        Files.writeString(dir.resolve("Tool_1.0_alice.7z"), "x");
        Plugin local = orchestrator.rescan().enabled().get(0);

        orchestrator.delete(local).get(10, TimeUnit.SECONDS);

        assertFalse(Files.exists(dir.resolve("Tool_1.0_alice.7z")));
        assertEquals(1, registry.getEnabled().size());
        assertTrue(finished.isEmpty());
    }

    @Test
    void delete_shouldFailForMissingFile() {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.EDGELESS, new MarketConfig());
        Plugin ghost = new Plugin("Ghost", "1.0", "x", "", "1 B", "Ghost_1.0_x.7z", "");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> orchestrator.delete(ghost).get(10, TimeUnit.SECONDS));

        assertInstanceOf(PluginNotFoundException.class, ex.getCause());
    }

    @Test
    void enable_shouldReleaseTaskWhenOperationDiesWithError() throws Exception {
        LocalPluginScanner brokenScanner = mock(LocalPluginScanner.class);
        when(brokenScanner.scan(any(), any())).thenThrow(new NoClassDefFoundError("scanner"));
        LifecycleOrchestrator orchestrator = new LifecycleOrchestrator(ModeProfile.CLOUD_PE, registry, tasks,
                brokenScanner, downloadEngine(), new FixedBootRootProvider(bootRoot), new MarketConfig(), pool, eventBus);
        Path dir = Files.createDirectories(bootRoot.resolve("ce-apps"));
        Files.writeString(dir.resolve("Tool_1.0_alice_d.CBK"), "x");
        Plugin disabled = new Plugin("Tool", "1.0", "alice", "d", "1 B", "Tool_1.0_alice_d.CBK", "");

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(orchestrator.enable(disabled)));

        assertInstanceOf(NoClassDefFoundError.class, ex.getCause());
        assertFalse(orchestrator.isRunning(disabled, OperationKind.ENABLE));
        assertFalse(finished.get(0).success());
        assertTrue(Files.exists(dir.resolve("Tool_1.0_alice_d.ce")));
    }

    // -- download --

    @Test
    void download_shouldWriteToExplicitDirectoryWithoutRescan() throws Exception {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.CLOUD_PE, new MarketConfig());
        Plugin remote = remote("Tool", "1.0", "alice", "d", "/plugin");

        Path written = await(orchestrator.download(remote, downloadDir));

        assertEquals(downloadDir.resolve("Tool_1.0_alice_d.ce"), written);
        assertTrue(Files.exists(written));
        assertTrue(registry.getEnabled().isEmpty());
    }

    @Test
    void download_shouldFallBackToConfiguredDirectory() throws Exception {
        MarketConfig config = new MarketConfig();
        config.setDefaultDownloadPath(downloadDir.toString());
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.EDGELESS, config);

        Path written = await(orchestrator.download(remote("Tool", "1.0", "alice", "", "/plugin"), null));

        assertEquals(downloadDir.resolve("Tool_1.0_alice.7z"), written);
    }

    @Test
    void download_shouldFailWithoutAnyDirectory() {
        LifecycleOrchestrator orchestrator = orchestrator(ModeProfile.EDGELESS, new MarketConfig());

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(orchestrator.download(remote("Tool", "1.0", "alice", "", "/plugin"), null)));

        assertInstanceOf(PluginNotFoundException.class, ex.getCause());
    }

    // -- helpers --

    private LifecycleOrchestrator orchestrator(ModeProfile mode, MarketConfig config) {
        return new LifecycleOrchestrator(mode, registry, tasks, new LocalPluginScanner(), downloadEngine(),
                new FixedBootRootProvider(bootRoot), config, pool, eventBus);
    }

    private DownloadEngine downloadEngine() {
        return new DownloadEngine(new MarketHttpClient(new MarketConfig()));
    }

    private Plugin remote(String name, String version, String author, String description, String path) {
        return new Plugin(name, version, author, description, "14 B", "", baseUrl + path);
    }

    private static <T> T await(Optional<CompletableFuture<T>> future) throws Exception {
        return future.orElseThrow().get(10, TimeUnit.SECONDS);
    }
}
