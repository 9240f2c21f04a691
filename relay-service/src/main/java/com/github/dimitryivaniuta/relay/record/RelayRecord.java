package com.github.dimitryivaniuta.relay.record;

import java.time.Instant;

/**
 * Row view of {@code relay_record}: the audit trail of one ingest transaction.
 * Payloads are JSON text exactly as stored.
 */
public record RelayRecord(
        Long id,
        String schemaName,
        int schemaVersion,
        String rawPayload,
        String transformedPayload,     // null unless status has a transformed payload
        String destinationUrl,
        RecordStatus status,
        int forwardAttempts,
        String lastError,
        String idempotencyKey,
        Instant nextAttemptAt,
        Instant leaseUntil,
        Instant createdAt,
        Instant updatedAt
) {}
