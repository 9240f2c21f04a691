package com.github.dimitryivaniuta.relay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.InvalidIdempotencyKeyException;
import com.github.dimitryivaniuta.relay.error.InvalidQueryException;
import com.github.dimitryivaniuta.relay.error.PayloadValidationException;
import com.github.dimitryivaniuta.relay.error.RecordNotFoundException;
import com.github.dimitryivaniuta.relay.error.RegistryUnavailableException;
import com.github.dimitryivaniuta.relay.forward.ForwardingWorker;
import com.github.dimitryivaniuta.relay.record.NewRecord;
import com.github.dimitryivaniuta.relay.record.RecordStatus;
import com.github.dimitryivaniuta.relay.record.RecordStore;
import com.github.dimitryivaniuta.relay.record.RelayRecord;
import com.github.dimitryivaniuta.relay.registry.RegistryClient;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import com.github.dimitryivaniuta.relay.support.TestSchemas;
import com.github.dimitryivaniuta.relay.transform.MappingTransformer;
import com.github.dimitryivaniuta.relay.transform.SchemaMapping;
import com.github.dimitryivaniuta.relay.validation.PayloadValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.github.dimitryivaniuta.relay.support.TestSchemas.json;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    @Mock
    private RegistryClient registry;
    @Mock
    private RecordStore store;
    @Mock
    private ForwardingWorker worker;

    private RelayProperties props;
    private SimpleMeterRegistry meters;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new RelayProperties();
        meters = new SimpleMeterRegistry();
        orchestrator = new PipelineOrchestrator(registry, new PayloadValidator(), new MappingTransformer(props),
                store, worker, new ObjectMapper(), props, meters);
    }

    private static RelayRecord saved(long id, NewRecord n) {
        Instant now = Instant.now();
        return new RelayRecord(id, n.schemaName(), n.schemaVersion(), n.rawPayload(), n.transformedPayload(),
                n.destinationUrl(), n.status(), 0, n.lastError(), n.idempotencyKey(), null, null, now, now);
    }

    private void storeAssignsId(long id) {
        when(store.insert(any())).thenAnswer(inv -> Mono.just(saved(id, inv.getArgument(0))));
    }

    @Test
    void validPayloadIsPersistedThenHandedToWorker() {
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        storeAssignsId(10L);

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 9.99}"), null))
                .assertNext(o -> {
                    assertFalse(o.replayed());
                    assertEquals(10L, o.record().id());
                    assertEquals(RecordStatus.PERSISTED, o.record().status());
                })
                .verifyComplete();

        ArgumentCaptor<NewRecord> captor = ArgumentCaptor.forClass(NewRecord.class);
        verify(store).insert(captor.capture());
        assertEquals("{\"id\":1,\"amount\":9.99}", captor.getValue().rawPayload());
        assertEquals("{\"id\":1,\"amount\":9.99}", captor.getValue().transformedPayload());
        verify(worker).submit(10L);
        assertEquals(1.0, meters.counter("relay.ingest", "outcome", "persisted").count());
    }

    @Test
    void invalidPayloadCreatesNoRecord() {
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1}"), null))
                .expectErrorSatisfies(ex -> {
                    assertInstanceOf(PayloadValidationException.class, ex);
                    assertTrue(((PayloadValidationException) ex).getFieldPath().endsWith("amount"));
                })
                .verify();

        verifyNoInteractions(store, worker);
        assertEquals(1.0, meters.counter("relay.ingest", "outcome", "validation_failed").count());
    }

    @Test
    void registryOutageIsSurfacedWithoutRecord() {
        when(registry.fetch("order", 2)).thenReturn(Mono.error(new RegistryUnavailableException("down")));

        StepVerifier.create(orchestrator.ingest("order", 2, json("{\"id\": 1, \"amount\": 1}"), null))
                .expectError(RegistryUnavailableException.class)
                .verify();

        verifyNoInteractions(store, worker);
    }

    @Test
    void transformFailureIsPersistedAndNotForwarded() {
        SchemaMapping m = new SchemaMapping();
        m.getEnums().put("status", Map.of("NEW", "created"));
        RelayProperties.SchemaSettings s = new RelayProperties.SchemaSettings();
        s.setMapping(m);
        props.getSchemas().put("order", s);
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        storeAssignsId(11L);

        StepVerifier.create(orchestrator.ingest("order", null,
                        json("{\"id\": 1, \"amount\": 1, \"status\": \"LOST\"}"), null))
                .assertNext(o -> {
                    assertEquals(RecordStatus.FAILED_TRANSFORM, o.record().status());
                    assertNull(o.record().transformedPayload());
                    assertTrue(o.record().lastError().contains("LOST"));
                })
                .verifyComplete();

        verify(worker, never()).submit(anyLong());
        verify(worker, never()).process(anyLong());
    }

    @Test
    void knownIdempotencyKeyReplaysExistingRecord() {
        RelayRecord existing = saved(5L, NewRecord.persisted("order", 1, "{}", "{}", "http://dest", "key-1"));
        when(store.findByIdempotencyKey("order", "key-1")).thenReturn(Mono.just(existing));

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 1}"), " key-1 "))
                .assertNext(o -> {
                    assertTrue(o.replayed());
                    assertEquals(5L, o.record().id());
                })
                .verifyComplete();

        verifyNoInteractions(registry);
        verify(store, never()).insert(any());
    }

    @Test
    void concurrentDuplicateKeyFallsBackToExistingRecord() {
        RelayRecord existing = saved(6L, NewRecord.persisted("order", 1, "{}", "{}", "http://dest", "key-2"));
        when(store.findByIdempotencyKey("order", "key-2"))
                .thenReturn(Mono.empty())
                .thenReturn(Mono.just(existing));
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        when(store.insert(any())).thenReturn(Mono.error(new DuplicateKeyException("ux_relay_record_idempotency")));

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 1}"), "key-2"))
                .assertNext(o -> {
                    assertTrue(o.replayed());
                    assertEquals(6L, o.record().id());
                })
                .verifyComplete();
    }

    @Test
    void inlineFirstAttemptReportsStatusAfterAttempt() {
        props.getForwarding().setInlineFirstAttempt(true);
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        storeAssignsId(12L);
        Instant now = Instant.now();
        RelayRecord forwarded = new RelayRecord(12L, "order", 1, "{}", "{}", "http://dest", RecordStatus.FORWARDED, 1,
                null, null, null, null, now, now);
        when(worker.process(12L)).thenReturn(Mono.just(forwarded));

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 1}"), null))
                .assertNext(o -> assertEquals(RecordStatus.FORWARDED, o.record().status()))
                .verifyComplete();
        verify(worker, never()).submit(anyLong());
    }

    @Test
    void rowsAreIngestedIndependently() {
        when(registry.fetch(eq("order"), any())).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        storeAssignsId(20L);

        StepVerifier.create(orchestrator.ingestRows("order", null, List.of(
                        json("{\"id\": 1, \"amount\": 1}"),
                        json("{\"id\": 2}"),
                        json("{\"id\": 3, \"amount\": 3}"))))
                .assertNext(r -> assertEquals(1, r.row()))
                .assertNext(r -> {
                    assertEquals(2, r.row());
                    assertInstanceOf(PayloadValidationException.class, r.error());
                })
                .assertNext(r -> assertNotNull(r.record()))
                .verifyComplete();
        verify(store, times(2)).insert(any());
    }

    @Test
    void uploadedTextCellsAreTypedByTheSchemaColumns() {
        SchemaDescriptor contact = new SchemaDescriptor("contact", 3, json("""
                {
                  "type": "object",
                  "required": ["id", "zip"],
                  "properties": {
                    "id": {"type": "integer"},
                    "zip": {"type": "string"},
                    "vip": {"type": "boolean"}
                  }
                }
                """), "http://dest/contacts");
        when(registry.fetch(eq("contact"), any())).thenReturn(Mono.just(contact));
        storeAssignsId(30L);

        StepVerifier.create(orchestrator.ingestRows("contact", null, List.of(
                        json("{\"id\": \"7\", \"zip\": \"12345\", \"vip\": \"true\"}"))))
                .assertNext(r -> assertNull(r.error()))
                .verifyComplete();

        ArgumentCaptor<NewRecord> inserted = ArgumentCaptor.forClass(NewRecord.class);
        verify(store).insert(inserted.capture());
        assertEquals("{\"id\":7,\"zip\":\"12345\",\"vip\":true}", inserted.getValue().rawPayload());
        assertEquals(3, inserted.getValue().schemaVersion());
        verify(registry).fetch("contact", null);
        verify(registry).fetch("contact", 3);
    }

    @Test
    void overlongIdempotencyKeyIsRejectedBeforeAnyLookup() {
        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 9.99}"),
                        "k".repeat(NewRecord.MAX_IDEMPOTENCY_KEY_LENGTH + 1)))
                .expectError(InvalidIdempotencyKeyException.class)
                .verify();

        verifyNoInteractions(registry, store, worker);
        assertEquals(1.0, meters.counter("relay.ingest", "outcome", "invalid_idempotency_key").count());
    }

    @Test
    void idempotencyKeyAtColumnWidthIsAccepted() {
        String key = "k".repeat(NewRecord.MAX_IDEMPOTENCY_KEY_LENGTH);
        when(store.findByIdempotencyKey("order", key)).thenReturn(Mono.empty());
        when(registry.fetch("order", null)).thenReturn(Mono.just(TestSchemas.order(1, "http://dest/orders")));
        storeAssignsId(31L);

        StepVerifier.create(orchestrator.ingest("order", null, json("{\"id\": 1, \"amount\": 9.99}"), key))
                .assertNext(o -> assertEquals(key, o.record().idempotencyKey()))
                .verifyComplete();
    }

    @Test
    void queryRejectsNonPositiveLimitAndNegativeOffset() {
        StepVerifier.create(orchestrator.query("order", 0, 0)).expectError(InvalidQueryException.class).verify();
        StepVerifier.create(orchestrator.query("order", 10, -1)).expectError(InvalidQueryException.class).verify();
        StepVerifier.create(orchestrator.query(" ", 10, 0)).expectError(InvalidQueryException.class).verify();
        verifyNoInteractions(store);
    }

    @Test
    void queryClampsLimitAndAppliesDefaults() {
        when(store.findBySchema(anyString(), anyInt(), anyInt())).thenReturn(Flux.empty());

        StepVerifier.create(orchestrator.query("order", 5000, 20))
                .assertNext(page -> {
                    assertEquals(100, page.limit());
                    assertEquals(20, page.offset());
                    assertTrue(page.records().isEmpty());
                })
                .verifyComplete();
        StepVerifier.create(orchestrator.query("order", null, null))
                .assertNext(page -> assertEquals(10, page.limit()))
                .verifyComplete();

        verify(store).findBySchema("order", 100, 20);
        verify(store).findBySchema(eq("order"), eq(10), eq(0));
    }

    @Test
    void unknownRecordIsNotFound() {
        when(store.findById(99L)).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.get(99L)).expectError(RecordNotFoundException.class).verify();
    }
}
