package de.bsommerfeld.pluginmarket.core.error;

/**
 * A filesystem operation on the plugin directory failed (create, read,
 * write, rename or delete).
 */
public class PluginIoException extends MarketException {

    public PluginIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
