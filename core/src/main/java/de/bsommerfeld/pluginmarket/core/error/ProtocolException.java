package de.bsommerfeld.pluginmarket.core.error;

/**
 * Thrown when a server answered but the answer is unusable.
 */
public class ProtocolException extends MarketException {

    public enum Reason {
        /** The payload carried a non-success {@code code} or {@code state}. */
        REJECTED,
        /** The HTTP status was outside 2xx. */
        HTTP_STATUS,
        /** The body was not JSON or did not match the expected schema. */
        MALFORMED
    }

    private final Reason reason;
    private final int statusCode;

    public ProtocolException(Reason reason, String message) {
        this(reason, message, -1, null);
    }

    public ProtocolException(Reason reason, String message, Throwable cause) {
        this(reason, message, -1, cause);
    }

    public ProtocolException(int statusCode, String url) {
        this(Reason.HTTP_STATUS, "HTTP " + statusCode + " for " + url, statusCode, null);
    }

    private ProtocolException(Reason reason, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    /** HTTP status for {@link Reason#HTTP_STATUS}, otherwise {@code -1}. */
    public int getStatusCode() {
        return statusCode;
    }
}
