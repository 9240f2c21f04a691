package com.github.dimitryivaniuta.relay.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import java.util.List;
import java.util.Set;

/** Cell and row handling shared by the file readers. */
final class CellValues {

    /** Markers read as a missing value. */
    static final Set<String> NA_VALUES = Set.of("", "NA", "N/A", "null", "NULL", "None", "NONE");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private CellValues() {
    }

    /** Trimmed text, or JSON null for a missing value. */
    static JsonNode cell(String raw) {
        String s = raw == null ? "" : raw.trim();
        return NA_VALUES.contains(s) ? NODES.nullNode() : NODES.textNode(s);
    }

    static ObjectNode newRow() {
        return NODES.objectNode();
    }

    static boolean hasValue(ObjectNode row) {
        for (JsonNode v : row) {
            if (!v.isNull()) return true;
        }
        return false;
    }

    static void add(List<ObjectNode> rows, ObjectNode row, String filename, int maxRows) {
        if (rows.size() >= maxRows) {
            throw new InvalidUploadException("File '" + filename + "' exceeds " + maxRows + " rows");
        }
        rows.add(row);
    }
}
