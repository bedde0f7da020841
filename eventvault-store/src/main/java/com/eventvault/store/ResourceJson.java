package com.eventvault.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * The single JSON encoding used for resource documents: pretty-printed UTF-8
 * with a trailing newline.
 */
public final class ResourceJson {

    private ResourceJson() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] toBytes(JsonNode value) throws IOException {
        String json = MAPPER.writeValueAsString(value) + "\n";
        return json.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parse a document.
     *
     * @throws IOException if the bytes are not exactly one complete JSON value
     */
    public static JsonNode parse(byte[] bytes) throws IOException {
        JsonNode node = MAPPER.readTree(bytes);
        if (node == null || node instanceof MissingNode) {
            throw new IOException("empty document");
        }
        return node;
    }

    public static JsonNode parse(String json) {
        try {
            return parse(json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid JSON literal: " + json, e);
        }
    }

    public static JsonNode valueToTree(Object value) {
        return MAPPER.valueToTree(value);
    }
}
