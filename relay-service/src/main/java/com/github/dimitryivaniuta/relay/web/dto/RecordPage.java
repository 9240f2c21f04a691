package com.github.dimitryivaniuta.relay.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

@Jacksonized
@Builder
public record RecordPage(
        @Schema(description = "Schema name") String schemaName,
        @Schema(description = "Effective limit (after clamping)") int limit,
        @Schema(description = "Offset") int offset,
        @Schema(description = "Records in creation order") List<RecordView> records
) {}
