package com.yerin.openshow.registry;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Primitive shapes a payload field can be declared with.
 */
public enum FieldKind {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public boolean matches(JsonNode value) {
        if (value == null) return false;
        return switch (this) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case ARRAY -> value.isArray();
            case OBJECT -> value.isObject();
        };
    }

    public String label() {
        return name().toLowerCase();
    }

    public static String describe(JsonNode value) {
        if (value == null || value.isMissingNode()) return "missing";
        if (value.isNull()) return "null";
        for (FieldKind kind : values()) {
            if (kind.matches(value)) return kind.label();
        }
        return value.getNodeType().name().toLowerCase();
    }
}
