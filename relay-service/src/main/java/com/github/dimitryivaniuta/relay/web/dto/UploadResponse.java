package com.github.dimitryivaniuta.relay.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Per-row results of a file upload. */
@Jacksonized
@Builder
public record UploadResponse(
        String schemaName,
        String fileName,
        @Schema(description = "Rows that produced a record") int accepted,
        @Schema(description = "Rows rejected before persistence") int rejected,
        List<RowResult> rows
) {
    @Jacksonized
    @Builder
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record RowResult(
            @Schema(description = "1-based data row number") int row,
            Long recordId,
            String status,
            String errorCode,
            String error,
            Map<String, Object> details
    ) {}
}
