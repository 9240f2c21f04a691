package com.github.dimitryivaniuta.relay.error;

/**
 * Transport, timeout or server failure talking to the schema registry.
 * Transient at the ingest boundary: the caller retries the whole ingest.
 */
public class RegistryUnavailableException extends RelayException {

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegistryUnavailableException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "REGISTRY_UNAVAILABLE";
    }
}
