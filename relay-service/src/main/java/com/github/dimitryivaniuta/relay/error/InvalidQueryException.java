package com.github.dimitryivaniuta.relay.error;

public class InvalidQueryException extends RelayException {

    public InvalidQueryException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "INVALID_QUERY";
    }
}
