package com.github.dimitryivaniuta.relay.error;

import lombok.Getter;

/** The registry has no artifact (or no usable version) for the requested schema. */
@Getter
public class SchemaNotFoundException extends RelayException {

    private final String schemaName;
    private final Integer version;

    public SchemaNotFoundException(String schemaName, Integer version, String message) {
        super(message);
        this.schemaName = schemaName;
        this.version = version;
    }

    public static SchemaNotFoundException of(String schemaName, Integer version) {
        String v = version == null ? "latest" : "version " + version;
        return new SchemaNotFoundException(schemaName, version,
                "Schema '" + schemaName + "' (" + v + ") not found in registry");
    }

    @Override
    public String code() {
        return "SCHEMA_NOT_FOUND";
    }
}
