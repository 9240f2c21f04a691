package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gives uploaded text cells the JSON type their column declares in the schema.
 *
 * <p>A string cell is converted only when {@code properties.<column>.type} is (or lists)
 * {@code integer}, {@code number} or {@code boolean} and the text parses as that type.
 * Any other cell is left as it is, so a string column keeps {@code "12345"} as a string.</p>
 */
public final class SchemaTypedCells {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SchemaTypedCells() {
    }

    /** A typed copy of {@code row}; non-object rows and schemas without properties pass through. */
    public static JsonNode apply(JsonNode row, JsonNode schema) {
        JsonNode properties = schema == null ? null : schema.path("properties");
        if (!(row instanceof ObjectNode source) || properties == null || !properties.isObject()) {
            return row;
        }
        ObjectNode typed = source.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!f.getValue().isTextual()) continue;
            JsonNode converted = convert(f.getValue().textValue(), declaredTypes(properties.path(f.getKey())));
            if (converted != null) {
                typed.set(f.getKey(), converted);
            }
        }
        return typed;
    }

    private static Set<String> declaredTypes(JsonNode property) {
        JsonNode type = property.path("type");
        Set<String> types = new HashSet<>();
        if (type.isTextual()) {
            types.add(type.textValue());
        } else if (type.isArray()) {
            type.forEach(t -> types.add(t.asText()));
        }
        return types;
    }

    private static JsonNode convert(String s, Set<String> types) {
        if ((types.contains("integer") || types.contains("number")) && INTEGER.matcher(s).matches()) {
            BigInteger n = new BigInteger(s);
            if (n.bitLength() < 32) return NODES.numberNode(n.intValue());
            if (n.bitLength() < 64) return NODES.numberNode(n.longValue());
            return NODES.numberNode(n);
        }
        if (types.contains("number") && NUMBER.matcher(s).matches()) {
            return NODES.numberNode(new BigDecimal(s));
        }
        if (types.contains("boolean") && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
            return NODES.booleanNode(Boolean.parseBoolean(s));
        }
        return null;
    }
}
