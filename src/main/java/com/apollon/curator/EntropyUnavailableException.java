package com.apollon.curator;

/**
 * Signals that the remote entropy service could not supply random bytes.
 * <p>
 * Every failure mode (HTTP status, authentication, connection, timeout, malformed body) is reported through this
 * one exception; the {@link Reason} is informational. There is deliberately no local pseudo-random fallback.
 */
public class EntropyUnavailableException extends Exception {

    public enum Reason {
        HTTP_STATUS,
        UNAUTHORIZED,
        FORBIDDEN,
        CONNECTION,
        TIMEOUT,
        MALFORMED_RESPONSE,
        INTERRUPTED
    }

    private final Reason reason;
    private final int statusCode;

    public EntropyUnavailableException(Reason reason, String message) {
        this(reason, -1, message, null);
    }

    public EntropyUnavailableException(Reason reason, String message, Throwable cause) {
        this(reason, -1, message, cause);
    }

    public EntropyUnavailableException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the HTTP status code, or -1 if the failure happened before a response arrived
     */
    public int getStatusCode() {
        return statusCode;
    }
}
