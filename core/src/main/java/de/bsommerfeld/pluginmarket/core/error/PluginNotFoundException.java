package de.bsommerfeld.pluginmarket.core.error;

/**
 * The target of an operation does not exist: a local plugin file, the boot
 * root or the catalog entry for an installed plugin.
 */
public class PluginNotFoundException extends MarketException {

    public PluginNotFoundException(String message) {
        super(message);
    }
}
