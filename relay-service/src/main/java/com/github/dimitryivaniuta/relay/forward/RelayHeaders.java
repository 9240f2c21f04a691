package com.github.dimitryivaniuta.relay.forward;

/** Headers attached to every forwarded payload. */
public final class RelayHeaders {

    public static final String RECORD_ID = "X-Relay-Record-Id";
    public static final String SCHEMA = "X-Relay-Schema";
    public static final String SCHEMA_VERSION = "X-Relay-Schema-Version";

    private RelayHeaders() {
    }
}
