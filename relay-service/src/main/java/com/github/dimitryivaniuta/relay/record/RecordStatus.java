package com.github.dimitryivaniuta.relay.record;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lifecycle of one ingest transaction.
 *
 * <pre>
 * received -> validated -> transformed -> persisted -> forwarding -> forwarded
 *        \-> failed:validation  \-> failed:transform         \-> failed:forward
 * </pre>
 *
 * Only {@code persisted} and later (plus {@code failed:transform}) are ever stored;
 * the earlier states exist for the length of one ingest call.
 */
public enum RecordStatus {
    RECEIVED(0, "received"),
    VALIDATED(1, "validated"),
    TRANSFORMED(2, "transformed"),
    PERSISTED(3, "persisted"),
    FORWARDING(4, "forwarding"),
    FORWARDED(5, "forwarded"),
    FAILED_VALIDATION(6, "failed:validation"),
    FAILED_TRANSFORM(7, "failed:transform"),
    FAILED_FORWARD(8, "failed:forward");

    private final int code;
    private final String label;

    private static final Map<Integer, RecordStatus> LOOKUP =
            Arrays.stream(values())
                    .collect(Collectors.toUnmodifiableMap(RecordStatus::code, Function.identity()));

    private static final Map<RecordStatus, Set<RecordStatus>> NEXT = Map.of(
            RECEIVED, EnumSet.of(VALIDATED, FAILED_VALIDATION),
            VALIDATED, EnumSet.of(TRANSFORMED, FAILED_TRANSFORM),
            TRANSFORMED, EnumSet.of(PERSISTED),
            PERSISTED, EnumSet.of(FORWARDING),
            FORWARDING, EnumSet.of(FORWARDING, FORWARDED, FAILED_FORWARD)
    );

    RecordStatus(int code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Numeric code stored in DB (SMALLINT). */
    public int code() {
        return code;
    }

    /** External name, e.g. {@code failed:forward}. */
    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == FORWARDED || this == FAILED_VALIDATION || this == FAILED_TRANSFORM || this == FAILED_FORWARD;
    }

    /** True when a record in this state carries a transformed payload. */
    public boolean hasTransformedPayload() {
        return this == TRANSFORMED || this == PERSISTED || this == FORWARDING
                || this == FORWARDED || this == FAILED_FORWARD;
    }

    /**
     * Allowed forward moves; {@code forwarding -> forwarding} is a retry being rescheduled.
     */
    public boolean canTransitionTo(RecordStatus next) {
        return NEXT.getOrDefault(this, Set.of()).contains(next);
    }

    /** Resolve from a SMALLINT value. Throws if unknown. */
    public static RecordStatus fromCode(int code) {
        RecordStatus status = LOOKUP.get(code);
        if (status == null) {
            throw new IllegalArgumentException("Unknown RecordStatus code: " + code);
        }
        return status;
    }

    /** Convenience overload for any numeric type (Short, Integer, Long, etc.). */
    public static RecordStatus fromCode(Number code) {
        if (code == null) {
            throw new IllegalArgumentException("RecordStatus code must not be null");
        }
        return fromCode(code.intValue());
    }

    /** Resolve from the external label, e.g. {@code failed:forward}. */
    public static RecordStatus fromLabel(String label) {
        for (RecordStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown RecordStatus: " + label);
    }
}
