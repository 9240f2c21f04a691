package com.github.dimitryivaniuta.relay.record;

import java.time.Duration;
import java.time.Instant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage of {@link RelayRecord}s. Every status change is a guarded
 * compare-and-set on the current status, so a record never moves backward.
 */
public interface RecordStore {

    // --- ingest ---

    Mono<RelayRecord> insert(NewRecord record);

    Mono<RelayRecord> findById(long id);

    Mono<RelayRecord> findByIdempotencyKey(String schemaName, String idempotencyKey);

    // --- query path ---

    /** Records of one schema in creation order ({@code id} ascending). */
    Flux<RelayRecord> findBySchema(String schemaName, int limit, int offset);

    // --- forwarding ---

    /** {@code persisted}/{@code forwarding} records that are due and not leased, oldest first. */
    Flux<RelayRecord> findDue(Instant now, int batchSize);

    /**
     * Atomically leases a due record until {@code now + lease}. Emits the leased record,
     * or completes empty when it is not due, already leased or terminal.
     */
    Mono<RelayRecord> claim(long id, Instant now, Duration lease);

    /** {@code persisted -> forwarding}. Emits true when the row changed. */
    Mono<Boolean> markForwarding(long id, Instant now);

    /**
     * Records one finished forward attempt on a {@code forwarding} row: increments
     * {@code forward_attempts}, sets {@code next}, {@code last_error} and {@code next_attempt_at},
     * and releases the lease. Emits the updated record, or empty when the row was not forwarding.
     */
    Mono<RelayRecord> recordAttempt(long id, RecordStatus next, String lastError, Instant nextAttemptAt, Instant now);
}
