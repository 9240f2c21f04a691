package com.github.dimitryivaniuta.relay.transform;

/** Descriptor metadata that can be copied into the output. */
public enum DerivedField {
    SCHEMA_NAME,
    SCHEMA_VERSION
}
