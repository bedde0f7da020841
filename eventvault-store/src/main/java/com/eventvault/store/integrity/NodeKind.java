package com.eventvault.store.integrity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Expected JSON kind of a document or field.
 */
public enum NodeKind {
    OBJECT, ARRAY, STRING, NUMBER, BOOLEAN, ANY;

    public boolean matches(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return false;
        }
        return switch (this) {
            case OBJECT -> node.isObject();
            case ARRAY -> node.isArray();
            case STRING -> node.isTextual();
            case NUMBER -> node.isNumber();
            case BOOLEAN -> node.isBoolean();
            case ANY -> true;
        };
    }

    public static NodeKind of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ANY;
        }
        if (node.isObject())
            return OBJECT;
        if (node.isArray())
            return ARRAY;
        if (node.isTextual())
            return STRING;
        if (node.isNumber())
            return NUMBER;
        if (node.isBoolean())
            return BOOLEAN;
        return ANY;
    }

    /** Lower-case name used in fix descriptions, with "null" for JSON null. */
    public static String describe(JsonNode node) {
        if (node == null || node.isNull()) {
            return "null";
        }
        return of(node).name().toLowerCase();
    }
}
