package com.github.dimitryivaniuta.relay.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.relay.error.InvalidSchemaDefinitionException;
import com.github.dimitryivaniuta.relay.error.PayloadValidationException;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import com.github.dimitryivaniuta.relay.registry.SchemaKey;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaValidatorsConfig;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Structural validation of payloads against the JSON Schema (draft 7) held in a
 * {@link SchemaDescriptor}. Fail-fast: only the first violation is reported.
 *
 * <p>Compiled schemas are cached per (name, version); descriptors are immutable, so a cached
 * compilation never goes stale.</p>
 */
@Slf4j
@Component
public class PayloadValidator {

    private static final String KEYWORD_REQUIRED = "required";

    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final ConcurrentMap<SchemaKey, JsonSchema> compiled = new ConcurrentHashMap<>();

    public ValidatedPayload validate(JsonNode payload, SchemaDescriptor descriptor) {
        if (payload == null || payload.isMissingNode()) {
            throw new PayloadValidationException("$", "type", "$: payload is empty");
        }
        JsonSchema schema = compiled.computeIfAbsent(descriptor.key(), k -> compile(descriptor));

        ValidationMessage first;
        try {
            Set<ValidationMessage> errors = schema.validate(payload);
            first = errors.isEmpty() ? null : errors.iterator().next();
        } catch (JsonSchemaException e) {
            Set<ValidationMessage> messages = e.getValidationMessages();
            if (messages == null || messages.isEmpty()) {
                throw new PayloadValidationException("$", "schema", e.getMessage());
            }
            first = messages.iterator().next();
        }

        if (first != null) {
            String path = fieldPath(first);
            log.debug("Payload rejected by {}: {} ({})", descriptor.key(), first.getMessage(), first.getType());
            throw new PayloadValidationException(path, first.getType(), first.getMessage());
        }
        return new ValidatedPayload(payload, descriptor.key());
    }

    private JsonSchema compile(SchemaDescriptor descriptor) {
        SchemaValidatorsConfig config = new SchemaValidatorsConfig();
        config.setFailFast(true);
        try {
            return schemaFactory.getSchema(descriptor.definition(), config);
        } catch (RuntimeException e) {
            throw new InvalidSchemaDefinitionException(
                    "Schema " + descriptor.key() + " is not a usable JSON Schema: " + e.getMessage(), e);
        }
    }

    /** For {@code required} the reported path is the parent object; append the missing property. */
    private static String fieldPath(ValidationMessage message) {
        String path = message.getPath() == null ? "$" : message.getPath();
        Object[] args = message.getArguments();
        if (KEYWORD_REQUIRED.equals(message.getType()) && args != null && args.length > 0) {
            return path + "." + args[0];
        }
        return path;
    }
}
