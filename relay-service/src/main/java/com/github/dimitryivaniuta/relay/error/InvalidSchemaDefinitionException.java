package com.github.dimitryivaniuta.relay.error;

/** Registry content that cannot be compiled into a JSON Schema. */
public class InvalidSchemaDefinitionException extends RelayException {

    public InvalidSchemaDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "SCHEMA_INVALID";
    }
}
