package com.github.dimitryivaniuta.relay.registry;

/** Cache key: schema name plus resolved version. */
public record SchemaKey(String name, int version) {

    @Override
    public String toString() {
        return name + "@v" + version;
    }
}
