package de.bsommerfeld.pluginmarket.app;

import com.google.inject.AbstractModule;
import de.bsommerfeld.pluginmarket.core.boot.BootRootProvider;
import de.bsommerfeld.pluginmarket.core.boot.FixedBootRootProvider;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Guice module wiring the market for one mode.
 *
 * <p>
 * Components carry {@code @Singleton} and {@code @Inject} themselves and are
 * bound just-in-time; this module only supplies the values that come from
 * outside: the mode, the configuration and the boot root.
 */
public class MarketModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(MarketModule.class);

    private final ModeProfile mode;
    private final MarketConfig config;
    private final Path bootRootOverride;

    /**
     * @param bootRootOverride boot root from the command line, or
     *                         {@code null} to use the configured default
     */
    public MarketModule(ModeProfile mode, MarketConfig config, Path bootRootOverride) {
        this.mode = mode;
        this.config = config;
        this.bootRootOverride = bootRootOverride;
    }

    @Override
    protected void configure() {
        LOG.info("Market mode initialized: {}", mode);

        bind(ModeProfile.class).toInstance(mode);
        bind(MarketConfig.class).toInstance(config);
        bind(BootRootProvider.class).toInstance(new FixedBootRootProvider(resolveBootRoot()));
    }

    Path resolveBootRoot() {
        if (bootRootOverride != null) {
            return bootRootOverride;
        }
        String configured = config.getDefaultBootRoot();
        if (configured.isEmpty()) {
            LOG.info("No boot drive configured");
            return null;
        }
        return Paths.get(configured);
    }
}
