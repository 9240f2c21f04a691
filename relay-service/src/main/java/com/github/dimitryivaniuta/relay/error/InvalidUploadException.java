package com.github.dimitryivaniuta.relay.error;

/** Uploaded file has an unsupported format or cannot be parsed. */
public class InvalidUploadException extends RelayException {

    public InvalidUploadException(String message) {
        super(message);
    }

    public InvalidUploadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "BAD_REQUEST";
    }
}
