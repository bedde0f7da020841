package com.eventvault.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A slice of a large resource pushed in one remote call.
 *
 * @param index   0-based batch number
 * @param total   number of batches for this push
 * @param shape   how the records reassemble into the document
 * @param records the rows of this batch
 */
public record RecordBatch(int index, int total, Shape shape, List<JsonNode> records) {

    public enum Shape {
        /** Records are the array elements. */
        ARRAY,
        /** Records are {@code {"key":k,"value":v}} entries of an object. */
        OBJECT
    }

    public static final String ENTRY_KEY = "key";
    public static final String ENTRY_VALUE = "value";

    public RecordBatch {
        records = List.copyOf(records);
    }

    public boolean isFirst() {
        return index == 0;
    }

    public boolean isLast() {
        return index == total - 1;
    }

    /** Number of records a document would be split into. */
    public static int recordCount(JsonNode document) {
        return document.isContainerNode() ? document.size() : 1;
    }

    /**
     * Split a document into batches of at most {@code batchSize} records.
     * Only arrays and objects can be split.
     */
    public static List<RecordBatch> split(JsonNode document, int batchSize) {
        if (!document.isContainerNode()) {
            throw new IllegalArgumentException("Only arrays and objects can be batched");
        }
        Shape shape = document.isArray() ? Shape.ARRAY : Shape.OBJECT;
        List<JsonNode> rows = new ArrayList<>(document.size());
        if (shape == Shape.ARRAY) {
            document.forEach(rows::add);
        } else {
            Iterator<Map.Entry<String, JsonNode>> it = document.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                ObjectNode row = JsonNodeFactory.instance.objectNode();
                row.put(ENTRY_KEY, entry.getKey());
                row.set(ENTRY_VALUE, entry.getValue());
                rows.add(row);
            }
        }
        int size = Math.max(1, batchSize);
        int total = Math.max(1, (rows.size() + size - 1) / size);
        List<RecordBatch> batches = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            int from = i * size;
            int to = Math.min(rows.size(), from + size);
            batches.add(new RecordBatch(i, total, shape, rows.subList(from, to)));
        }
        return batches;
    }

    /**
     * Rebuild a document from the records of all its batches, in order.
     */
    public static JsonNode assemble(Shape shape, List<JsonNode> records) {
        if (shape == Shape.ARRAY) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            records.forEach(array::add);
            return array;
        }
        ObjectNode object = JsonNodeFactory.instance.objectNode();
        for (JsonNode row : records) {
            object.set(row.path(ENTRY_KEY).asText(), row.get(ENTRY_VALUE));
        }
        return object;
    }
}
