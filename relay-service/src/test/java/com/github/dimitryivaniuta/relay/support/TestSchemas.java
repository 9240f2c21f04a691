package com.github.dimitryivaniuta.relay.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;

/** Schema documents shared by tests. */
public final class TestSchemas {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    /** "order": {@code id} integer and {@code amount} number, both required. */
    public static final String ORDER_JSON = """
            {
              "$schema": "http://json-schema.org/draft-07/schema#",
              "type": "object",
              "required": ["id", "amount"],
              "properties": {
                "id": {"type": "integer"},
                "amount": {"type": "number", "minimum": 0},
                "status": {"type": "string"}
              }
            }
            """;

    private TestSchemas() {
    }

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static SchemaDescriptor order(int version, String destination) {
        return new SchemaDescriptor("order", version, json(ORDER_JSON), destination);
    }
}
