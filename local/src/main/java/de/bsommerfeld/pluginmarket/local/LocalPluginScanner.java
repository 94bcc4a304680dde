package de.bsommerfeld.pluginmarket.local;

import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.domain.LocalSnapshot;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginState;
import de.bsommerfeld.pluginmarket.core.error.PluginIoException;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.core.util.SizeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the plugin directory of a boot drive into a {@link LocalSnapshot}.
 *
 * <p>
 * Only regular files directly inside the directory are considered. Files
 * that are neither enabled nor disabled plugins, or whose names do not
 * decode, are skipped silently. Sizes always come from the file length,
 * never from the name. Duplicates (same name, version, author and size) are
 * collapsed separately within the enabled and the disabled list.
 *
 * <p>
 * Entries are returned in filename order so repeated scans are stable.
 */
@Singleton
public class LocalPluginScanner {

    private static final Logger LOG = LoggerFactory.getLogger(LocalPluginScanner.class);

    /**
     * Scans {@code pluginDir}, creating it first if it does not exist.
     *
     * @throws PluginIoException if the directory cannot be created or listed
     */
    public LocalSnapshot scan(Path pluginDir, ModeProfile mode) throws PluginIoException {
        try {
            Files.createDirectories(pluginDir);
        } catch (IOException e) {
            throw new PluginIoException("Cannot create plugin directory " + pluginDir, e);
        }

        List<Path> files = listFiles(pluginDir);
        List<Plugin> enabled = new ArrayList<>();
        List<Plugin> disabled = new ArrayList<>();
        Set<Plugin.DedupKey> seenEnabled = new HashSet<>();
        Set<Plugin.DedupKey> seenDisabled = new HashSet<>();

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            Optional<PluginState> state = FilenameCodec.classify(fileName, mode);
            if (state.isEmpty()) {
                continue;
            }
            Optional<Plugin> decoded = FilenameCodec.decode(fileName, mode);
            if (decoded.isEmpty()) {
                LOG.debug("Skipping {}: name does not match the {} grammar", fileName, mode.serverName());
                continue;
            }
            Optional<Plugin> sized = withFileSize(decoded.get(), file);
            if (sized.isEmpty()) {
                continue;
            }

            Plugin plugin = sized.get();
            if (state.get() == PluginState.ENABLED) {
                if (seenEnabled.add(plugin.dedupKey())) {
                    enabled.add(plugin);
                }
            } else if (seenDisabled.add(plugin.dedupKey())) {
                disabled.add(plugin);
            }
        }

        LOG.debug("Scanned {}: {} enabled, {} disabled", pluginDir, enabled.size(), disabled.size());
        return new LocalSnapshot(enabled, disabled);
    }

    private static List<Path> listFiles(Path dir) throws PluginIoException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            throw new PluginIoException("Cannot list plugin directory " + dir, e);
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }

    private static Optional<Plugin> withFileSize(Plugin plugin, Path file) {
        try {
            return Optional.of(plugin.withSize(SizeFormatter.format(Files.size(file))));
        } catch (IOException e) {
            LOG.debug("Skipping {}: cannot read its size ({})", file, e.getMessage());
            return Optional.empty();
        }
    }
}
