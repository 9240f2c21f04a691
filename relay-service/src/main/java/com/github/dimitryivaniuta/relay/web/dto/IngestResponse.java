package com.github.dimitryivaniuta.relay.web.dto;

import com.github.dimitryivaniuta.relay.record.RelayRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Answer to an ingest call. */
@Jacksonized
@Builder
public record IngestResponse(
        @Schema(description = "Id of the created (or replayed) record") Long recordId,
        @Schema(description = "Record status", example = "persisted") String status,
        @Schema(description = "Schema name") String schemaName,
        @Schema(description = "Resolved schema version") int schemaVersion,
        @Schema(description = "Last error, set for failed records") String lastError
) {
    public static IngestResponse of(RelayRecord r) {
        return IngestResponse.builder()
                .recordId(r.id())
                .status(r.status().label())
                .schemaName(r.schemaName())
                .schemaVersion(r.schemaVersion())
                .lastError(r.lastError())
                .build();
    }
}
