package com.github.dimitryivaniuta.relay.record;

import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static java.util.Objects.requireNonNull;

/**
 * R2DBC implementation of {@link RecordStore} on table {@code relay_record}.
 * Nullable columns go through {@link #bindMaybe} so a null is never bound directly.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RecordStoreImpl implements RecordStore {

    private static final String COLUMNS = """
            id, schema_name, schema_version, raw_payload, transformed_payload, destination_url,
            status, forward_attempts, last_error, idempotency_key, next_attempt_at, lease_until,
            created_at, updated_at
            """;

    private final DatabaseClient db;
    private final Clock clock;

    // ------------ INSERT --------------

    @Override
    public Mono<RelayRecord> insert(NewRecord r) {
        requireNonNull(r, "record");
        final OffsetDateTime now = utc(clock.instant());

        final String sql = """
            INSERT INTO relay_record
              (schema_name, schema_version, raw_payload, transformed_payload, destination_url,
               status, forward_attempts, last_error, idempotency_key, created_at, updated_at)
            VALUES
              (:schema_name, :schema_version, :raw_payload, :transformed_payload, :destination_url,
               :status, 0, :last_error, :idempotency_key, :now, :now)
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("schema_name", r.schemaName())
                .bind("schema_version", r.schemaVersion())
                .bind("raw_payload", r.rawPayload())
                .bind("destination_url", r.destinationUrl())
                .bind("status", (short) r.status().code())
                .bind("now", now);
        spec = bindMaybe(spec, "transformed_payload", r.transformedPayload(), String.class);
        spec = bindMaybe(spec, "last_error", r.lastError(), String.class);
        spec = bindMaybe(spec, "idempotency_key", r.idempotencyKey(), String.class);

        return spec.filter(s -> s.returnGeneratedValues())
                .map((row, md) -> row.get("id", Long.class))
                .one()
                .flatMap(this::findById)
                .doOnNext(saved -> log.debug("Inserted relay_record id={} schema={} status={}",
                        saved.id(), saved.schemaName(), saved.status().label()));
    }

    // ------------ READ --------------

    @Override
    public Mono<RelayRecord> findById(long id) {
        return db.sql("SELECT " + COLUMNS + " FROM relay_record WHERE id = :id")
                .bind("id", id)
                .map(RecordStoreImpl::mapRow)
                .one();
    }

    @Override
    public Mono<RelayRecord> findByIdempotencyKey(String schemaName, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) return Mono.empty();
        return db.sql("SELECT " + COLUMNS
                        + " FROM relay_record WHERE schema_name = :schema_name AND idempotency_key = :key")
                .bind("schema_name", schemaName)
                .bind("key", idempotencyKey)
                .map(RecordStoreImpl::mapRow)
                .one();
    }

    @Override
    public Flux<RelayRecord> findBySchema(String schemaName, int limit, int offset) {
        // LIMIT/OFFSET inlined: validated ints, and not every driver accepts binds there.
        final String sql = ("SELECT " + COLUMNS + """
                 FROM relay_record
                WHERE schema_name = :schema_name
                ORDER BY id ASC
                LIMIT %d OFFSET %d
                """).formatted(limit, offset);

        return db.sql(sql)
                .bind("schema_name", schemaName)
                .map(RecordStoreImpl::mapRow)
                .all();
    }

    // ------------ FORWARDING --------------

    @Override
    public Flux<RelayRecord> findDue(Instant now, int batchSize) {
        final String sql = ("SELECT " + COLUMNS + """
                 FROM relay_record
                WHERE status IN (%d, %d)
                  AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
                  AND (lease_until IS NULL OR lease_until < :now)
                ORDER BY id ASC
                LIMIT %d
                """).formatted(RecordStatus.PERSISTED.code(), RecordStatus.FORWARDING.code(), batchSize);

        return db.sql(sql)
                .bind("now", utc(now))
                .map(RecordStoreImpl::mapRow)
                .all();
    }

    @Override
    public Mono<RelayRecord> claim(long id, Instant now, Duration lease) {
        final String sql = """
            UPDATE relay_record
               SET lease_until = :until, updated_at = :now
             WHERE id = :id
               AND status IN (%d, %d)
               AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
               AND (lease_until IS NULL OR lease_until < :now)
            """.formatted(RecordStatus.PERSISTED.code(), RecordStatus.FORWARDING.code());

        return db.sql(sql)
                .bind("until", utc(now.plus(lease)))
                .bind("now", utc(now))
                .bind("id", id)
                .fetch().rowsUpdated()
                .flatMap(n -> n > 0 ? findById(id) : Mono.empty());
    }

    @Override
    public Mono<Boolean> markForwarding(long id, Instant now) {
        return transition(id, RecordStatus.PERSISTED, RecordStatus.FORWARDING, now);
    }

    @Override
    public Mono<RelayRecord> recordAttempt(long id, RecordStatus next, String lastError,
                                           Instant nextAttemptAt, Instant now) {
        if (!RecordStatus.FORWARDING.canTransitionTo(next)) {
            return Mono.error(new IllegalArgumentException("forwarding -> " + next.label() + " is not allowed"));
        }
        final String sql = """
            UPDATE relay_record
               SET status = :next,
                   forward_attempts = forward_attempts + 1,
                   last_error = :last_error,
                   next_attempt_at = :next_attempt_at,
                   lease_until = NULL,
                   updated_at = :now
             WHERE id = :id AND status = :expected
            """;

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql)
                .bind("next", (short) next.code())
                .bind("now", utc(now))
                .bind("id", id)
                .bind("expected", (short) RecordStatus.FORWARDING.code());
        spec = bindMaybe(spec, "last_error", lastError, String.class);
        spec = bindMaybe(spec, "next_attempt_at", nextAttemptAt == null ? null : utc(nextAttemptAt), OffsetDateTime.class);

        return spec.fetch().rowsUpdated()
                .flatMap(n -> n > 0 ? findById(id) : Mono.empty());
    }

    // ------------ HELPERS --------------

    private Mono<Boolean> transition(long id, RecordStatus expected, RecordStatus next, Instant now) {
        if (!expected.canTransitionTo(next)) {
            return Mono.error(new IllegalArgumentException(expected.label() + " -> " + next.label() + " is not allowed"));
        }
        return db.sql("""
                UPDATE relay_record SET status = :next, updated_at = :now
                 WHERE id = :id AND status = :expected
                """)
                .bind("next", (short) next.code())
                .bind("now", utc(now))
                .bind("id", id)
                .bind("expected", (short) expected.code())
                .fetch().rowsUpdated()
                .map(n -> n > 0);
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindMaybe(
            DatabaseClient.GenericExecuteSpec spec, String name, T value, Class<T> type) {
        return (value == null) ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    private static OffsetDateTime utc(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant instant(Row row, String column) {
        OffsetDateTime t = row.get(column, OffsetDateTime.class);
        return t == null ? null : t.toInstant();
    }

    static RelayRecord mapRow(Row row, RowMetadata md) {
        Number status = row.get("status", Short.class);
        Integer attempts = row.get("forward_attempts", Integer.class);
        Integer version = row.get("schema_version", Integer.class);
        return new RelayRecord(
                row.get("id", Long.class),
                row.get("schema_name", String.class),
                version == null ? 0 : version,
                row.get("raw_payload", String.class),
                row.get("transformed_payload", String.class),
                row.get("destination_url", String.class),
                RecordStatus.fromCode(status),
                attempts == null ? 0 : attempts,
                row.get("last_error", String.class),
                row.get("idempotency_key", String.class),
                instant(row, "next_attempt_at"),
                instant(row, "lease_until"),
                instant(row, "created_at"),
                instant(row, "updated_at")
        );
    }
}
