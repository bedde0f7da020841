package com.eventvault.store.integrity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A required field of an object-shaped resource.
 *
 * @param name         field name
 * @param kind         expected kind
 * @param members      constraint on elements (arrays) or values (objects)
 * @param defaultValue value used when the field is missing or unusable
 */
public record FieldSpec(String name, NodeKind kind, MemberKind members, JsonNode defaultValue) {

    public JsonNode newDefault() {
        return defaultValue.deepCopy();
    }
}
