package com.github.dimitryivaniuta.relay.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.service.PipelineOrchestrator;
import com.github.dimitryivaniuta.relay.web.dto.RecordPage;
import com.github.dimitryivaniuta.relay.web.dto.RecordView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Read path over stored records. */
@RestController
@RequestMapping("/api/records")
@RequiredArgsConstructor
@Tag(name = "Records")
public class RecordController {

    private final PipelineOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    @GetMapping("/{id}")
    @Operation(summary = "Read one record")
    public Mono<RecordView> get(@PathVariable long id) {
        return orchestrator.get(id).map(r -> RecordView.fromRecord(r, objectMapper));
    }

    /** Records of one schema in creation order; {@code limit} is clamped to the configured maximum. */
    @GetMapping
    @Operation(summary = "Page through the records of a schema")
    public Mono<RecordPage> query(@RequestParam(name = "schema", required = false) String schema,
                                  @RequestParam(required = false) Integer limit,
                                  @RequestParam(required = false) Integer offset) {
        return orchestrator.query(schema, limit, offset)
                .map(slice -> RecordPage.builder()
                        .schemaName(slice.schemaName())
                        .limit(slice.limit())
                        .offset(slice.offset())
                        .records(slice.records().stream().map(r -> RecordView.fromRecord(r, objectMapper)).toList())
                        .build());
    }
}
