package com.github.dimitryivaniuta.relay.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.relay.registry.SchemaKey;

/** Payload that passed structural validation against {@code schema}. */
public record ValidatedPayload(JsonNode payload, SchemaKey schema) {
}
