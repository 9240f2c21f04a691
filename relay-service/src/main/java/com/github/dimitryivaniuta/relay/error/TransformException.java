package com.github.dimitryivaniuta.relay.error;

import lombok.Getter;

/**
 * Payload is structurally valid but cannot be mapped to the destination shape.
 * Permanent; recorded on the record as {@code failed:transform}.
 */
@Getter
public class TransformException extends RelayException {

    private final String field;

    public TransformException(String field, String message) {
        super(message);
        this.field = field;
    }

    @Override
    public String code() {
        return "TRANSFORM_FAILED";
    }
}
