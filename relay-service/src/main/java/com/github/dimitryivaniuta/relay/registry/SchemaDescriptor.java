package com.github.dimitryivaniuta.relay.registry;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * One registry artifact version. Never updated in place: a new version is a new descriptor.
 *
 * @param name           stable schema identifier (registry artifact id)
 * @param version        registry-assigned, monotonic version
 * @param definition     JSON Schema document; treat as read-only
 * @param destinationUrl where accepted payloads for this schema are forwarded
 */
public record SchemaDescriptor(
        String name,
        int version,
        JsonNode definition,
        String destinationUrl
) {
    public SchemaDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(destinationUrl, "destinationUrl");
    }

    public SchemaKey key() {
        return new SchemaKey(name, version);
    }
}
