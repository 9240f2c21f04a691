package com.github.dimitryivaniuta.relay.service;

import com.github.dimitryivaniuta.relay.record.RelayRecord;

/**
 * Result of one ingest call.
 *
 * @param record   the created record, or the existing one on an idempotent replay
 * @param replayed true when the idempotency key matched an earlier record
 */
public record IngestOutcome(RelayRecord record, boolean replayed) {}
