package com.eventvault.sync;

import com.eventvault.store.ResourceJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RemoteBootstrapTest {

    @Test
    void fetch_mirrored_returnsCopy() {
        InMemoryConnector mirror = new InMemoryConnector();
        mirror.put("alias-map", ResourceJson.parse("{\"1\":\"Alpha\"}"));

        Optional<JsonNode> fetched = new RemoteBootstrap(mirror).fetch("alias-map");

        assertEquals(Optional.of(ResourceJson.parse("{\"1\":\"Alpha\"}")), fetched);
    }

    @Test
    void fetch_absent_isEmpty() {
        assertTrue(new RemoteBootstrap(new InMemoryConnector()).fetch("events").isEmpty());
    }

    @Test
    void fetch_offline_isEmptyWithoutCalling() {
        InMemoryConnector mirror = new InMemoryConnector();
        mirror.put("events", ResourceJson.parse("{}"));
        mirror.setConnected(false);

        assertTrue(new RemoteBootstrap(mirror).fetch("events").isEmpty());
        assertTrue(mirror.getCalls().isEmpty());
    }

    @Test
    void fetch_throttled_isEmpty() {
        InMemoryConnector mirror = new InMemoryConnector();
        mirror.put("events", ResourceJson.parse("{}"));
        mirror.throttleNext(1, 1000);

        assertTrue(new RemoteBootstrap(mirror).fetch("events").isEmpty());
    }
}
