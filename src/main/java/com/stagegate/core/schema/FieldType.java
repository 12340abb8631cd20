package com.stagegate.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/** JSON value types a schema can require of a field. */
public enum FieldType {
    STRING("string"),
    BOOLEAN("bool"),
    INTEGER("int"),
    LIST("list"),
    OBJECT("object");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(JsonNode node) {
        return switch (this) {
            case STRING -> node.isTextual();
            case BOOLEAN -> node.isBoolean();
            case INTEGER -> node.isIntegralNumber();
            case LIST -> node.isArray();
            case OBJECT -> node.isObject();
        };
    }

    public static String labelOf(JsonNode node) {
        if (node.isTextual()) return STRING.label;
        if (node.isBoolean()) return BOOLEAN.label;
        if (node.isIntegralNumber()) return INTEGER.label;
        if (node.isNumber()) return "float";
        if (node.isArray()) return LIST.label;
        if (node.isObject()) return OBJECT.label;
        return "null";
    }
}
