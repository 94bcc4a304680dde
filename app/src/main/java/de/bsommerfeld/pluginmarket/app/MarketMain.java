package de.bsommerfeld.pluginmarket.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.pluginmarket.core.config.ConfigLoader;
import de.bsommerfeld.pluginmarket.core.config.MarketConfig;
import de.bsommerfeld.pluginmarket.market.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless entry point. Parses the command line, wires the market for the
 * chosen mode and runs a single command.
 */
public final class MarketMain {

    private static final Logger LOG = LoggerFactory.getLogger(MarketMain.class);

    private MarketMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine line;
        try {
            line = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            System.out.println(CommandLine.USAGE);
            return MarketCli.EXIT_FAILURE;
        }

        MarketConfig config = ConfigLoader.load();
        Injector injector = Guice.createInjector(new MarketModule(line.mode(), config, line.bootRoot()));
        LOG.info("Running '{}' in {} mode", line.command(), line.mode());

        try {
            return injector.getInstance(MarketCli.class).run(line);
        } finally {
            injector.getInstance(WorkerPool.class).shutdown();
        }
    }
}
