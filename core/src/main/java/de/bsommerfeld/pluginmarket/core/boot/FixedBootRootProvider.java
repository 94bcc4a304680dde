package de.bsommerfeld.pluginmarket.core.boot;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A boot root chosen once at startup, e.g. from the command line or the
 * configuration file.
 */
public final class FixedBootRootProvider implements BootRootProvider {

    private final Path root;

    /**
     * @param root the boot root, or {@code null} for "no drive selected"
     */
    public FixedBootRootProvider(Path root) {
        this.root = root;
    }

    @Override
    public Optional<Path> currentBootRoot() {
        return Optional.ofNullable(root);
    }

    @Override
    public String toString() {
        return "FixedBootRootProvider[" + root + "]";
    }
}
