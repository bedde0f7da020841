package com.eventvault.sync;

import com.eventvault.store.ResourceJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordBatchTest {

    @Test
    void split_array_evenAndRemainder() {
        List<RecordBatch> batches = RecordBatch.split(ResourceJson.parse("[1,2,3,4,5]"), 2);

        assertEquals(3, batches.size());
        assertTrue(batches.get(0).isFirst());
        assertTrue(batches.get(2).isLast());
        assertEquals(1, batches.get(2).records().size());
        assertEquals(RecordBatch.Shape.ARRAY, batches.get(0).shape());
    }

    @Test
    void split_object_usesKeyValueRows() {
        List<RecordBatch> batches = RecordBatch.split(ResourceJson.parse("{\"7\":\"Alpha\"}"), 50);

        JsonNode row = batches.get(0).records().get(0);
        assertEquals("7", row.get(RecordBatch.ENTRY_KEY).asText());
        assertEquals("Alpha", row.get(RecordBatch.ENTRY_VALUE).asText());
    }

    @Test
    void split_empty_yieldsOneEmptyBatch() {
        List<RecordBatch> batches = RecordBatch.split(ResourceJson.parse("[]"), 10);

        assertEquals(1, batches.size());
        assertTrue(batches.get(0).records().isEmpty());
    }

    @Test
    void split_scalar_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RecordBatch.split(ResourceJson.parse("true"), 10));
    }

    @Test
    void assemble_rebuildsObject() {
        JsonNode doc = ResourceJson.parse("{\"a\":1,\"b\":[2],\"c\":{\"d\":3}}");
        List<JsonNode> rows = new ArrayList<>();
        RecordBatch.split(doc, 2).forEach(b -> rows.addAll(b.records()));

        assertEquals(doc, RecordBatch.assemble(RecordBatch.Shape.OBJECT, rows));
    }

    @Test
    void recordCount_scalarCountsAsOne() {
        assertEquals(1, RecordBatch.recordCount(ResourceJson.parse("false")));
        assertEquals(3, RecordBatch.recordCount(ResourceJson.parse("{\"a\":1,\"b\":2,\"c\":3}")));
    }
}
