package de.bsommerfeld.pluginmarket.core.error;

/**
 * Thrown when a remote endpoint cannot be reached: DNS failure, refused
 * connection, timeout or a broken transfer.
 */
public class NetworkException extends MarketException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
