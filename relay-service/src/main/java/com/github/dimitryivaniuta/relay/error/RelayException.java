package com.github.dimitryivaniuta.relay.error;

/**
 * Base type for every failure the relay reports to callers.
 */
public abstract class RelayException extends RuntimeException {

    protected RelayException(String message) {
        super(message);
    }

    protected RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code used in API error payloads. */
    public abstract String code();
}
