package com.github.dimitryivaniuta.relay.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.record.RelayRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Public view of a relay record; payloads are returned as JSON, not as escaped text. */
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordView(
        @Schema(description = "Record id") Long id,
        @Schema(description = "Schema name") String schemaName,
        @Schema(description = "Schema version") int schemaVersion,
        @Schema(description = "Payload as received") JsonNode rawPayload,
        @Schema(description = "Destination-ready payload") JsonNode transformedPayload,
        @Schema(description = "Destination URL") String destinationUrl,
        @Schema(description = "Status", example = "forwarded") String status,
        @Schema(description = "Forward attempts made") int forwardAttempts,
        @Schema(description = "Last error") String lastError,
        @Schema(description = "Idempotency key supplied on ingest") String idempotencyKey,
        @Schema(description = "Next retry time for records being forwarded") Instant nextAttemptAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static RecordView fromRecord(RelayRecord r, ObjectMapper om) {
        return RecordView.builder()
                .id(r.id())
                .schemaName(r.schemaName())
                .schemaVersion(r.schemaVersion())
                .rawPayload(parse(r.rawPayload(), om))
                .transformedPayload(parse(r.transformedPayload(), om))
                .destinationUrl(r.destinationUrl())
                .status(r.status().label())
                .forwardAttempts(r.forwardAttempts())
                .lastError(r.lastError())
                .idempotencyKey(r.idempotencyKey())
                .nextAttemptAt(r.nextAttemptAt())
                .createdAt(r.createdAt())
                .updatedAt(r.updatedAt())
                .build();
    }

    private static JsonNode parse(String json, ObjectMapper om) {
        if (json == null) return null;
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            // stored text is not JSON; show it verbatim
            return om.getNodeFactory().textNode(json);
        }
    }
}
