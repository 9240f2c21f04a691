package com.github.dimitryivaniuta.relay.record;

import java.util.Objects;

/**
 * Values for a record about to be inserted. Only {@code persisted} and
 * {@code failed:transform} rows are created by the pipeline.
 */
public record NewRecord(
        String schemaName,
        int schemaVersion,
        String rawPayload,
        String transformedPayload,
        String destinationUrl,
        RecordStatus status,
        String lastError,
        String idempotencyKey
) {
    /** Width of the {@code idempotency_key} column. */
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 200;

    public NewRecord {
        Objects.requireNonNull(schemaName, "schemaName");
        Objects.requireNonNull(rawPayload, "rawPayload");
        Objects.requireNonNull(destinationUrl, "destinationUrl");
        Objects.requireNonNull(status, "status");
        if (status.hasTransformedPayload() != (transformedPayload != null)) {
            throw new IllegalArgumentException("transformedPayload must be set iff status " + status.label()
                    + " is at or past transformed");
        }
    }

    public static NewRecord persisted(String schemaName, int version, String raw, String transformed,
                                      String destinationUrl, String idempotencyKey) {
        return new NewRecord(schemaName, version, raw, transformed, destinationUrl,
                RecordStatus.PERSISTED, null, idempotencyKey);
    }

    public static NewRecord failedTransform(String schemaName, int version, String raw,
                                            String destinationUrl, String error, String idempotencyKey) {
        return new NewRecord(schemaName, version, raw, null, destinationUrl,
                RecordStatus.FAILED_TRANSFORM, error, idempotencyKey);
    }
}
