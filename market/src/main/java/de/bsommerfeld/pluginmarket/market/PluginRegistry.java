package de.bsommerfeld.pluginmarket.market;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.domain.LocalSnapshot;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginCategory;
import de.bsommerfeld.pluginmarket.core.domain.PluginIdentity;
import de.bsommerfeld.pluginmarket.core.domain.PluginStatus;
import de.bsommerfeld.pluginmarket.core.util.VersionComparator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory view of the remote catalog and the local plugin directory.
 *
 * <h3>Replacement</h3>
 * The catalog and the local snapshot are only ever replaced as a whole.
 * Readers see either the old or the new state, never a mix. The write lock
 * is held just for swapping references; all fetching and scanning happens
 * before.
 *
 * <h3>Identity index</h3>
 * Installed plugins are looked up by {@link PluginIdentity}, built from the
 * enabled list only. If several enabled files share an identity the last
 * one scanned wins.
 */
@Singleton
public class PluginRegistry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<PluginCategory> categories = List.of();
    private LocalSnapshot local = LocalSnapshot.empty();
    private Map<PluginIdentity, Plugin> enabledIndex = Map.of();

    // =====================================================================
    // Replacement
    // =====================================================================

    public void replaceCatalog(List<PluginCategory> newCategories) {
        List<PluginCategory> copy = List.copyOf(newCategories);
        lock.writeLock().lock();
        try {
            categories = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void replaceLocal(LocalSnapshot snapshot) {
        Map<PluginIdentity, Plugin> index = new HashMap<>();
        for (Plugin plugin : snapshot.enabled()) {
            index.put(plugin.identity(), plugin);
        }
        lock.writeLock().lock();
        try {
            local = snapshot;
            enabledIndex = index;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // =====================================================================
    // Catalog queries
    // =====================================================================

    public List<PluginCategory> getCategories() {
        lock.readLock().lock();
        try {
            return categories;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Plugins of the category with the given label, empty if there is none. */
    public List<Plugin> categoryPlugins(String label) {
        for (PluginCategory category : getCategories()) {
            if (category.label().equals(label)) {
                return category.plugins();
            }
        }
        return List.of();
    }

    /**
     * Case-insensitive substring search over name, author, description and
     * version of every catalog entry. Entries listed in several categories
     * are returned once, in catalog order.
     */
    public List<Plugin> search(String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        List<Plugin> results = new ArrayList<>();
        Set<Plugin.DedupKey> seen = new HashSet<>();

        for (PluginCategory category : getCategories()) {
            for (Plugin plugin : category.plugins()) {
                String haystack = String.join(" ",
                        plugin.name(), plugin.author(), plugin.description(), plugin.version())
                        .toLowerCase(Locale.ROOT);
                if (haystack.contains(needle) && seen.add(plugin.dedupKey())) {
                    results.add(plugin);
                }
            }
        }
        return results;
    }

    /** First catalog entry with the identity, in catalog order. */
    public Optional<Plugin> findRemoteByIdentity(PluginIdentity identity) {
        for (PluginCategory category : getCategories()) {
            for (Plugin plugin : category.plugins()) {
                if (plugin.identity().equals(identity)) {
                    return Optional.of(plugin);
                }
            }
        }
        return Optional.empty();
    }

    // =====================================================================
    // Local queries
    // =====================================================================

    /** Enabled local plugin with the identity. */
    public Optional<Plugin> findLocalByIdentity(PluginIdentity identity) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(enabledIndex.get(identity));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Local plugin, enabled or disabled, stored under {@code fileName}. */
    public Optional<Plugin> findLocalByFile(String fileName) {
        LocalSnapshot snapshot = getLocal();
        for (Plugin plugin : snapshot.enabled()) {
            if (plugin.file().equals(fileName)) {
                return Optional.of(plugin);
            }
        }
        for (Plugin plugin : snapshot.disabled()) {
            if (plugin.file().equals(fileName)) {
                return Optional.of(plugin);
            }
        }
        return Optional.empty();
    }

    public List<Plugin> getEnabled() {
        return getLocal().enabled();
    }

    public List<Plugin> getDisabled() {
        return getLocal().disabled();
    }

    public LocalSnapshot getLocal() {
        lock.readLock().lock();
        try {
            return local;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Install state of a catalog entry: not installed when no enabled plugin
     * shares its identity, update available when the installed version is
     * older, installed otherwise.
     */
    public PluginStatus statusOf(Plugin remote) {
        Optional<Plugin> installed = findLocalByIdentity(remote.identity());
        if (installed.isEmpty()) {
            return PluginStatus.NOT_INSTALLED;
        }
        int cmp = VersionComparator.compareVersions(installed.get().version(), remote.version());
        return cmp < 0 ? PluginStatus.UPDATE_AVAILABLE : PluginStatus.INSTALLED;
    }
}
