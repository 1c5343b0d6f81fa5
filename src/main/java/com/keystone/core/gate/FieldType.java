package com.keystone.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * JSON field types an output contract can declare.
 */
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public boolean matches(JsonNode node) {
        return switch (this) {
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case INTEGER -> node.isIntegralNumber();
            case BOOLEAN -> node.isBoolean();
            case ARRAY -> node.isArray();
            case OBJECT -> node.isObject();
        };
    }

    /** Whether schema autofix can fill a missing field of this type with an empty default. */
    public boolean autofixable() {
        return this == STRING || this == ARRAY || this == OBJECT;
    }

    public JsonNode emptyDefault() {
        return switch (this) {
            case STRING -> JsonNodeFactory.instance.textNode("");
            case ARRAY -> JsonNodeFactory.instance.arrayNode();
            case OBJECT -> JsonNodeFactory.instance.objectNode();
            default -> throw new IllegalStateException(this + " has no empty default");
        };
    }
}
