package com.eventvault.store;

import com.eventvault.store.integrity.ResourceSchema;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A declared resource: its stable key, its file under the data directory,
 * its documented default and its shape.
 */
public record ResourceDefinition(String key, String fileName, JsonNode defaultValue, ResourceSchema schema) {

    /** A private copy of the default, safe to mutate. */
    public JsonNode newDefault() {
        return defaultValue.deepCopy();
    }

    ResourceDefinition withDefault(JsonNode value) {
        return new ResourceDefinition(key, fileName, value, schema);
    }
}
