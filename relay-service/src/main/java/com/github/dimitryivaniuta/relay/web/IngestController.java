package com.github.dimitryivaniuta.relay.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.relay.service.PipelineOrchestrator;
import com.github.dimitryivaniuta.relay.service.RowOutcome;
import com.github.dimitryivaniuta.relay.upload.UploadReader;
import com.github.dimitryivaniuta.relay.web.dto.IngestResponse;
import com.github.dimitryivaniuta.relay.web.dto.UploadResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Ingest API: one structured payload per call, or a CSV/Excel file with one payload per row.
 */
@Slf4j
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
@Tag(name = "Ingest")
public class IngestController {

    public static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

    private final PipelineOrchestrator orchestrator;
    private final UploadReader uploadReader;

    /** 201 with the new record, or 200 with the existing one when the idempotency key was seen before. */
    @PostMapping(path = "/{schemaName}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Validate, transform, persist and forward one payload")
    public Mono<ResponseEntity<IngestResponse>> ingest(
            @PathVariable String schemaName,
            @RequestParam(required = false) Integer version,
            @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody JsonNode payload) {
        return orchestrator.ingest(schemaName, version, payload, idempotencyKey)
                .map(o -> ResponseEntity.status(o.replayed() ? HttpStatus.OK : HttpStatus.CREATED)
                        .body(IngestResponse.of(o.record())));
    }

    @PostMapping(path = "/{schemaName}/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Ingest every row of a CSV or Excel file as an independent payload")
    public Mono<UploadResponse> upload(
            @PathVariable String schemaName,
            @RequestParam(required = false) Integer version,
            @RequestPart("file") FilePart file) {
        String filename = file.filename();
        if (!uploadReader.supports(filename)) {
            return Mono.error(uploadReader.unsupported(filename));
        }
        return DataBufferUtils.join(file.content())
                .map(buf -> {
                    byte[] bytes = new byte[buf.readableByteCount()];
                    buf.read(bytes);
                    DataBufferUtils.release(buf);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> uploadReader.read(filename, bytes))
                .flatMap(rows -> orchestrator.ingestRows(schemaName, version, rows).collectList())
                .map(outcomes -> toResponse(schemaName, filename, outcomes))
                .doOnNext(r -> log.info("Upload {} for '{}': {} accepted, {} rejected",
                        filename, schemaName, r.accepted(), r.rejected()));
    }

    private static UploadResponse toResponse(String schemaName, String filename, List<RowOutcome> outcomes) {
        List<UploadResponse.RowResult> rows = outcomes.stream()
                .map(o -> o.error() == null
                        ? UploadResponse.RowResult.builder()
                                .row(o.row())
                                .recordId(o.record().id())
                                .status(o.record().status().label())
                                .error(o.record().lastError())
                                .build()
                        : UploadResponse.RowResult.builder()
                                .row(o.row())
                                .errorCode(o.error().code())
                                .error(o.error().getMessage())
                                .details(RestExceptionHandler.detailsOf(o.error()))
                                .build())
                .toList();
        int accepted = (int) outcomes.stream().filter(o -> o.error() == null).count();
        return UploadResponse.builder()
                .schemaName(schemaName)
                .fileName(filename)
                .accepted(accepted)
                .rejected(outcomes.size() - accepted)
                .rows(rows)
                .build();
    }
}
