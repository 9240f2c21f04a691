package com.github.dimitryivaniuta.relay.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.relay.registry.SchemaKey;

/** Destination-ready payload produced for {@code schema}. */
public record TransformedPayload(JsonNode payload, SchemaKey schema) {
}
