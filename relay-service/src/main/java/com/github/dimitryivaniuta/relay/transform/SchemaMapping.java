package com.github.dimitryivaniuta.relay.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Declarative field mapping for one schema. Steps run in this order:
 * rename, enums, coerce, constants, derived. Every step after {@code rename}
 * addresses fields by their destination name.
 *
 * <p>YAML keys that contain characters other than letters, digits and dashes must be
 * bracketed, e.g. {@code "[user_id]": userId}.</p>
 */
@Getter
@Setter
@ToString
public class SchemaMapping {

    /** Keep source fields that have no rename entry under their original name. */
    private boolean includeUnmapped = true;

    /** Source field name to destination field name. */
    private Map<String, String> rename = new LinkedHashMap<>();

    /** Destination field to value table; a value missing from the table is unmappable. */
    private Map<String, Map<String, String>> enums = new LinkedHashMap<>();

    /** Destination field to target JSON type. */
    private Map<String, CoercionType> coerce = new LinkedHashMap<>();

    /** Destination field to constant string value added to every output. */
    private Map<String, String> constants = new LinkedHashMap<>();

    /** Destination field to descriptor metadata. */
    private Map<String, DerivedField> derived = new LinkedHashMap<>();
}
