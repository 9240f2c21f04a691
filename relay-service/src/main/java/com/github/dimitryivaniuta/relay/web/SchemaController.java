package com.github.dimitryivaniuta.relay.web;

import com.github.dimitryivaniuta.relay.service.PipelineOrchestrator;
import com.github.dimitryivaniuta.relay.web.dto.SchemaView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Diagnostics over the schema cache. */
@RestController
@RequestMapping("/api/schemas")
@RequiredArgsConstructor
@Tag(name = "Schemas")
public class SchemaController {

    private final PipelineOrchestrator orchestrator;

    @GetMapping("/{name}")
    @Operation(summary = "Resolve a schema (latest unless a version is given)")
    public Mono<SchemaView> get(@PathVariable String name, @RequestParam(required = false) Integer version) {
        return orchestrator.describeSchema(name, version).map(SchemaView::of);
    }

    /** Forces a registry round-trip for the latest version and replaces the cached entry. */
    @PostMapping("/{name}/refresh")
    @Operation(summary = "Refetch the latest version from the registry")
    public Mono<SchemaView> refresh(@PathVariable String name) {
        return orchestrator.refreshSchema(name).map(SchemaView::of);
    }
}
