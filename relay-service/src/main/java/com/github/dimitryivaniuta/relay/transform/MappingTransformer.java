package com.github.dimitryivaniuta.relay.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.dimitryivaniuta.relay.config.RelayProperties;
import com.github.dimitryivaniuta.relay.error.TransformException;
import com.github.dimitryivaniuta.relay.registry.SchemaDescriptor;
import com.github.dimitryivaniuta.relay.validation.ValidatedPayload;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * {@link PayloadTransformer} driven by {@code relay.schemas.<name>.mapping}.
 * A schema without a mapping is passed through unchanged.
 */
@Component
@RequiredArgsConstructor
public class MappingTransformer implements PayloadTransformer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final RelayProperties props;

    @Override
    public TransformedPayload transform(ValidatedPayload validated, SchemaDescriptor descriptor) {
        SchemaMapping mapping = props.schema(descriptor.name()).getMapping();
        JsonNode source = validated.payload();

        if (mapping == null) {
            return new TransformedPayload(source.deepCopy(), descriptor.key());
        }
        if (!source.isObject()) {
            throw new TransformException("$", "Field mapping of '" + descriptor.name()
                    + "' requires a JSON object payload, got " + source.getNodeType());
        }

        ObjectNode out = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            String target = mapping.getRename().get(f.getKey());
            if (target == null) {
                if (!mapping.isIncludeUnmapped()) continue;
                target = f.getKey();
            }
            out.set(target, f.getValue().deepCopy());
        }

        mapping.getEnums().forEach((field, table) -> {
            JsonNode v = out.get(field);
            if (v == null || v.isNull()) return;
            String mapped = table.get(v.asText());
            if (mapped == null) {
                throw new TransformException(field,
                        "Value '" + v.asText() + "' of '" + field + "' has no destination equivalent");
            }
            out.put(field, mapped);
        });

        mapping.getCoerce().forEach((field, type) -> {
            JsonNode v = out.get(field);
            if (v == null || v.isNull()) return;
            out.set(field, coerce(field, v, type));
        });

        mapping.getConstants().forEach(out::put);

        mapping.getDerived().forEach((field, derived) -> {
            switch (derived) {
                case SCHEMA_NAME -> out.put(field, descriptor.name());
                case SCHEMA_VERSION -> out.put(field, descriptor.version());
            }
        });

        return new TransformedPayload(out, descriptor.key());
    }

    static JsonNode coerce(String field, JsonNode v, CoercionType type) {
        if (v.isContainerNode()) {
            throw new TransformException(field, "Cannot coerce " + v.getNodeType() + " '" + field + "' to " + type);
        }
        return switch (type) {
            case STRING -> v.isTextual() ? v : TextNode.valueOf(v.asText());
            case INTEGER -> toInteger(field, v);
            case DECIMAL -> DecimalNode.valueOf(toDecimal(field, v));
            case BOOLEAN -> toBoolean(field, v);
        };
    }

    private static JsonNode toInteger(String field, JsonNode v) {
        if (v.isInt()) return v;
        if (v.isBoolean()) {
            throw new TransformException(field, "Cannot coerce boolean '" + field + "' to INTEGER");
        }
        try {
            long n = toDecimal(field, v).longValueExact();
            return (n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE) ? IntNode.valueOf((int) n) : LongNode.valueOf(n);
        } catch (ArithmeticException e) {
            throw new TransformException(field, "Value '" + v.asText() + "' of '" + field + "' is not a whole number");
        }
    }

    private static BigDecimal toDecimal(String field, JsonNode v) {
        if (v.isNumber()) return v.decimalValue();
        if (v.isTextual()) {
            try {
                return new BigDecimal(v.asText().trim());
            } catch (NumberFormatException e) {
                throw new TransformException(field, "Value '" + v.asText() + "' of '" + field + "' is not numeric");
            }
        }
        throw new TransformException(field, "Cannot coerce " + v.getNodeType() + " '" + field + "' to a number");
    }

    private static JsonNode toBoolean(String field, JsonNode v) {
        if (v.isBoolean()) return v;
        if (v.isTextual()) {
            String s = v.asText().trim();
            if ("true".equalsIgnoreCase(s)) return BooleanNode.TRUE;
            if ("false".equalsIgnoreCase(s)) return BooleanNode.FALSE;
        }
        if (v.isIntegralNumber() && (v.asLong() == 0L || v.asLong() == 1L)) {
            return BooleanNode.valueOf(v.asLong() == 1L);
        }
        throw new TransformException(field, "Value '" + v.asText() + "' of '" + field + "' is not a boolean");
    }
}
