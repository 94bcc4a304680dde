package de.bsommerfeld.pluginmarket.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user configuration directory following each platform's
 * conventions. Paths are absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME} (fallback:
 * {@code ~/.config})</li>
 * </ul>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /**
     * Returns the platform configuration root, without an application
     * sub-directory.
     */
    public static Path getConfigRoot() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support");
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null ? Paths.get(appData) : Paths.get(home, "AppData", "Roaming");
        }
        String xdgConfig = System.getenv("XDG_CONFIG_HOME");
        if (xdgConfig != null && !xdgConfig.isEmpty()) {
            return Paths.get(xdgConfig);
        }
        return Paths.get(home, ".config");
    }

    /**
     * Returns {@code {configRoot}/{appName}}. The directory is not guaranteed
     * to exist.
     */
    public static Path getConfigDir(String appName) {
        return getConfigRoot().resolve(appName);
    }
}
