package de.bsommerfeld.pluginmarket.core.boot;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Supplies the root of the currently selected boot drive. Discovering and
 * choosing the drive is done elsewhere; the market only reads the result.
 */
@FunctionalInterface
public interface BootRootProvider {

    /**
     * @return the selected boot root, or empty if none is selected
     */
    Optional<Path> currentBootRoot();
}
