package de.bsommerfeld.pluginmarket.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.pluginmarket.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads and writes {@link MarketConfig} as JSON.
 *
 * <h3>Location</h3>
 * {@code <config-root>/CloudPE/plugin_market.json}, unless the system property
 * {@value #CONFIG_PROPERTY} names another file.
 *
 * <h3>Failure handling</h3>
 * A missing file yields defaults. An unreadable or malformed file is logged
 * and also yields defaults; the broken file is left untouched until the
 * next {@link #save}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PROPERTY = "market.config";
    static final String APP_DIR = "CloudPE";
    static final String FILE_NAME = "plugin_market.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConfigLoader() {
    }

    /** Resolves the configuration file path, honoring {@value #CONFIG_PROPERTY}. */
    public static Path defaultPath() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return StorageUtils.getConfigDir(APP_DIR).resolve(FILE_NAME);
    }

    public static MarketConfig load() {
        return load(defaultPath());
    }

    public static MarketConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
            return new MarketConfig();
        }
        try {
            MarketConfig config = MAPPER.readValue(path.toFile(), MarketConfig.class);
            LOG.info("Loaded configuration from {}", path.toAbsolutePath());
            return config != null ? config : new MarketConfig();
        } catch (IOException e) {
            LOG.warn("Failed to read configuration {}, using defaults: {}", path, e.getMessage());
            return new MarketConfig();
        }
    }

    /**
     * Writes the configuration as pretty-printed JSON, creating parent
     * directories as needed.
     */
    public static void save(MarketConfig config, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
        LOG.debug("Saved configuration to {}", path.toAbsolutePath());
    }
}
