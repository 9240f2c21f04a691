package com.github.dimitryivaniuta.relay.error;

/** Idempotency key that the record store cannot hold. */
public class InvalidIdempotencyKeyException extends RelayException {

    public InvalidIdempotencyKeyException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "INVALID_IDEMPOTENCY_KEY";
    }
}
