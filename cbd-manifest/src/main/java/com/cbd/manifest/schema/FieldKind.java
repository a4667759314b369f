package com.cbd.manifest.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/** JSON kind a manifest field must have. */
public enum FieldKind {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    OBJECT("object"),
    ARRAY("array");

    private final String label;

    FieldKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** True when {@code node} has this kind. Null and missing nodes never match. */
    public boolean matches(JsonNode node) {
        if (node == null) return false;
        switch (this) {
            case STRING:
                return node.isTextual();
            case BOOLEAN:
                return node.isBoolean();
            case INTEGER:
                return node.isIntegralNumber();
            case OBJECT:
                return node.isObject();
            case ARRAY:
                return node.isArray();
            default:
                throw new IllegalStateException("Unhandled kind " + this);
        }
    }

    /** Label of the kind actually found, as used in "Expected x, received y" messages. */
    public static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) return "undefined";
        if (node.isNull()) return "null";
        if (node.isTextual()) return "string";
        if (node.isBoolean()) return "boolean";
        if (node.isIntegralNumber()) return "integer";
        if (node.isNumber()) return "number";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
