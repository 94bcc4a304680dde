package de.bsommerfeld.pluginmarket.market;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size pool that runs catalog loads, probes and lifecycle operations
 * off the caller's thread. Threads are daemons so a pending download never
 * keeps the JVM alive.
 */
@Singleton
public class WorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutorService executor;

    @Inject
    public WorkerPool(MarketConfig config) {
        this(Executors.newFixedThreadPool(config.getWorkerThreads(), new ThreadFactoryBuilder()
                .setNameFormat("market-worker-%d")
                .setDaemon(true)
                .build()));
    }

    public WorkerPool(ExecutorService executor) {
        this.executor = executor;
    }

    public ExecutorService executor() {
        return executor;
    }

    /**
     * Stops accepting work and waits briefly for running tasks.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate in time, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
