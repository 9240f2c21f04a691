package com.github.dimitryivaniuta.relay.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

@Jacksonized
@Builder
public record SchemaView(
        @Schema(description = "Schema name") String name,
        @Schema(description = "Resolved version") int version,
        @Schema(description = "Where accepted payloads are forwarded") String destinationUrl,
        @Schema(description = "JSON Schema document") JsonNode definition
) {
    public static SchemaView of(SchemaDescriptor d) {
        return new SchemaView(d.name(), d.version(), d.destinationUrl(), d.definition());
    }
}
