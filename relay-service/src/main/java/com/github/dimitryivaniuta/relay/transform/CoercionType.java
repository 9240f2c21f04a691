package com.github.dimitryivaniuta.relay.transform;

/** Target JSON type of a coerced field. */
public enum CoercionType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN
}
