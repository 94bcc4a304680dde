package de.bsommerfeld.pluginmarket.core.domain;

/**
 * {@code (name, author)} pair that links a catalog entry to the installed
 * file of the same plugin, regardless of version.
 */
public record PluginIdentity(String name, String author) {

    @Override
    public String toString() {
        return name + "_" + author;
    }
}
