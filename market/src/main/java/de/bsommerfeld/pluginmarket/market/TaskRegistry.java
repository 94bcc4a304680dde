package de.bsommerfeld.pluginmarket.market;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.domain.TaskKey;
import de.bsommerfeld.pluginmarket.remote.download.DownloadProgress;
import de.bsommerfeld.pluginmarket.remote.download.ProgressTracker;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Operations currently in flight, keyed by plugin identity and kind. Each
 * entry holds the progress tracker of its transfer.
 */
@Singleton
public class TaskRegistry {

    private final ConcurrentMap<TaskKey, ProgressTracker> running = new ConcurrentHashMap<>();

    /**
     * Registers a task unless one with the same key is already running.
     *
     * @return {@code true} if the caller now owns the key
     */
    public boolean tryStart(TaskKey key, ProgressTracker tracker) {
        return running.putIfAbsent(key, tracker) == null;
    }

    public void finish(TaskKey key) {
        running.remove(key);
    }

    public boolean isRunning(TaskKey key) {
        return running.containsKey(key);
    }

    /** Latest progress of a running task, empty if none runs under the key. */
    public Optional<DownloadProgress> progress(TaskKey key) {
        ProgressTracker tracker = running.get(key);
        return tracker == null ? Optional.empty() : Optional.of(tracker.current());
    }

    public Set<TaskKey> runningKeys() {
        return Set.copyOf(running.keySet());
    }
}
