package com.github.dimitryivaniuta.relay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidIdempotencyKeyException;
import com.github.dimitryivaniuta.relay.error.InvalidQueryException;
import com.github.dimitryivaniuta.relay.error.RecordNotFoundException;
import com.github.dimitryivaniuta.relay.error.RelayException;
import com.github.dimitryivaniuta.relay.error.TransformException;
import com.github.dimitryivaniuta.relay.forward.ForwardingWorker;
import com.github.dimitryivaniuta.relay.record.NewRecord;
import com.github.dimitryivaniuta.relay.record.RecordStore;
import com.github.dimitryivaniuta.relay.record.RelayRecord;
import com.github.dimitryivaniuta.relay.registry.RegistryClient;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import com.github.dimitryivaniuta.relay.transform.PayloadTransformer;
import com.github.dimitryivaniuta.relay.transform.TransformedPayload;
import com.github.dimitryivaniuta.relay.upload.SchemaTypedCells;
import com.github.dimitryivaniuta.relay.validation.PayloadValidator;
import com.github.dimitryivaniuta.relay.validation.ValidatedPayload;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs one ingest through registry lookup, validation, transformation and persistence,
 * then hands the record to the {@link ForwardingWorker}. Also serves the read path.
 *
 * <p>Rejections before persistence (unknown schema, registry down, invalid payload) are
 * returned as errors and leave no record behind. A transform failure is persisted as
 * {@code failed:transform}. A record is always stored before any forward attempt.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final RegistryClient registry;
    private final PayloadValidator validator;
    private final PayloadTransformer transformer;
    private final RecordStore store;
    private final ForwardingWorker worker;
    private final ObjectMapper objectMapper;
    private final RelayProperties props;
    private final MeterRegistry meters;

    // ------------ INGEST --------------

    public Mono<IngestOutcome> ingest(String schemaName, Integer version, JsonNode payload, String idempotencyKey) {
        final String key = (idempotencyKey == null || idempotencyKey.isBlank()) ? null : idempotencyKey.trim();
        if (key != null && key.length() > NewRecord.MAX_IDEMPOTENCY_KEY_LENGTH) {
            return Mono.<IngestOutcome>error(new InvalidIdempotencyKeyException("Idempotency key is "
                            + key.length() + " characters; at most " + NewRecord.MAX_IDEMPOTENCY_KEY_LENGTH + " allowed"))
                    .doOnError(RelayException.class, this::countRejection);
        }

        Mono<IngestOutcome> fresh = Mono.defer(() -> registry.fetch(schemaName, version))
                .flatMap(descriptor -> runPipeline(descriptor, payload, key))
                .map(r -> new IngestOutcome(r, false));

        if (key != null) {
            fresh = fresh.onErrorResume(DataIntegrityViolationException.class, ex -> {
                // Lost a race with a concurrent ingest carrying the same key.
                log.info("Idempotency key '{}' of schema '{}' taken concurrently; returning existing record", key, schemaName);
                return replay(schemaName, key).switchIfEmpty(Mono.error(ex));
            });
            fresh = replay(schemaName, key).switchIfEmpty(fresh);
        }

        return fresh
                .doOnNext(o -> meters.counter("relay.ingest", "outcome",
                        o.replayed() ? "replayed" : o.record().status().label()).increment())
                .doOnError(RelayException.class, this::countRejection);
    }

    private void countRejection(RelayException ex) {
        meters.counter("relay.ingest", "outcome", ex.code().toLowerCase(Locale.ROOT)).increment();
    }

    /**
     * Ingests uploaded rows independently against one resolved schema version; a rejected row
     * does not stop the others. Text cells are typed by the columns the schema declares first.
     */
    public Flux<RowOutcome> ingestRows(String schemaName, Integer version, List<? extends JsonNode> rows) {
        return Mono.defer(() -> registry.fetch(schemaName, version))
                .flatMapMany(d -> Flux.range(0, rows.size())
                        .concatMap(i -> ingest(schemaName, d.version(),
                                        SchemaTypedCells.apply(rows.get(i), d.definition()), null)
                                .map(o -> RowOutcome.accepted(i + 1, o.record()))
                                .onErrorResume(RelayException.class, ex -> Mono.just(RowOutcome.rejected(i + 1, ex)))));
    }

    private Mono<IngestOutcome> replay(String schemaName, String key) {
        return store.findByIdempotencyKey(schemaName, key)
                .doOnNext(r -> log.info("Replay of idempotency key '{}' for schema '{}' -> record {}", key, schemaName, r.id()))
                .map(r -> new IngestOutcome(r, true));
    }

    private Mono<RelayRecord> runPipeline(SchemaDescriptor descriptor, JsonNode payload, String key) {
        return Mono.fromCallable(() -> validator.validate(payload, descriptor))
                .doOnError(RelayException.class, ex -> log.warn("Ingest for {} rejected: {}", descriptor.key(), ex.getMessage()))
                .flatMap(validated -> transformAndPersist(descriptor, validated, key));
    }

    private Mono<RelayRecord> transformAndPersist(SchemaDescriptor d, ValidatedPayload validated, String key) {
        final String raw = toJson(validated.payload());
        final TransformedPayload transformed;
        try {
            transformed = transformer.transform(validated, d);
        } catch (TransformException e) {
            log.warn("Transform of {} payload failed at '{}': {}", d.key(), e.getField(), e.getMessage());
            return store.insert(NewRecord.failedTransform(d.name(), d.version(), raw, d.destinationUrl(),
                            e.getMessage(), key))
                    .doOnNext(r -> log.info("Ingest {} -> record {} ({})", d.key(), r.id(), r.status().label()));
        }

        return store.insert(NewRecord.persisted(d.name(), d.version(), raw, toJson(transformed.payload()),
                        d.destinationUrl(), key))
                .doOnNext(r -> log.info("Ingest {} -> record {} ({})", d.key(), r.id(), r.status().label()))
                .flatMap(this::dispatch);
    }

    private Mono<RelayRecord> dispatch(RelayRecord saved) {
        if (props.getForwarding().isInlineFirstAttempt()) {
            return worker.process(saved.id())
                    .switchIfEmpty(Mono.defer(() -> store.findById(saved.id())))
                    .onErrorResume(ex -> {
                        log.error("Inline forward of record {} failed; the poller will retry", saved.id(), ex);
                        return Mono.just(saved);
                    });
        }
        worker.submit(saved.id());
        return Mono.just(saved);
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize payload", e);
        }
    }

    // ------------ READ --------------

    public Mono<RelayRecord> get(long id) {
        return store.findById(id)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException(id)));
    }

    /**
     * Records of one schema in creation order. A null limit means the configured default;
     * a limit above the configured maximum is clamped to it.
     */
    public Mono<RecordSlice> query(String schemaName, Integer limit, Integer offset) {
        return Mono.defer(() -> {
            if (schemaName == null || schemaName.isBlank()) {
                return Mono.error(new InvalidQueryException("schema must not be blank"));
            }
            RelayProperties.Query q = props.getQuery();
            int requested = limit == null ? q.getDefaultLimit() : limit;
            int from = offset == null ? 0 : offset;
            if (requested <= 0) {
                return Mono.error(new InvalidQueryException("limit must be positive, got " + requested));
            }
            if (from < 0) {
                return Mono.error(new InvalidQueryException("offset must not be negative, got " + from));
            }
            int effective = Math.min(requested, q.getMaxLimit());
            return store.findBySchema(schemaName, effective, from)
                    .collectList()
                    .map(records -> new RecordSlice(schemaName, effective, from, records));
        });
    }

    // ------------ SCHEMAS --------------

    public Mono<SchemaDescriptor> describeSchema(String name, Integer version) {
        return registry.fetch(name, version);
    }

    public Mono<SchemaDescriptor> refreshSchema(String name) {
        return registry.refetch(name, null);
    }
}
