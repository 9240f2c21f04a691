package com.github.dimitryivaniuta.relay.error;

public class RecordNotFoundException extends RelayException {

    public RecordNotFoundException(long id) {
        super("Record " + id + " not found");
    }

    @Override
    public String code() {
        return "RECORD_NOT_FOUND";
    }
}
