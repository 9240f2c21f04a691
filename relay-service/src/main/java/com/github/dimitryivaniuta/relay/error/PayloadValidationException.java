package com.github.dimitryivaniuta.relay.error;

import lombok.Getter;

/**
 * First structural violation found in a payload. Permanent; no record is persisted.
 */
@Getter
public class PayloadValidationException extends RelayException {

    /** JSON path of the failing field, e.g. {@code $.amount}. */
    private final String fieldPath;

    /** Violated schema keyword, e.g. {@code required} or {@code type}. */
    private final String constraint;

    public PayloadValidationException(String fieldPath, String constraint, String message) {
        super(message);
        this.fieldPath = fieldPath;
        this.constraint = constraint;
    }

    @Override
    public String code() {
        return "VALIDATION_FAILED";
    }
}
