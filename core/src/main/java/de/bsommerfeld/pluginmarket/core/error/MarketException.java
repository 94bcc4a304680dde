package de.bsommerfeld.pluginmarket.core.error;

/**
 * Base of all failures raised by the plugin market. Callers that only care
 * whether an operation worked catch this type.
 */
public class MarketException extends Exception {

    public MarketException(String message) {
        super(message);
    }

    public MarketException(String message, Throwable cause) {
        super(message, cause);
    }
}
