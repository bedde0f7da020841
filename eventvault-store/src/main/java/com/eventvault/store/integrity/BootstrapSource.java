package com.eventvault.store.integrity;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Somewhere to recover a resource that is missing locally, tried before
 * falling back to the documented default. Must not throw.
 */
@FunctionalInterface
public interface BootstrapSource {

    BootstrapSource NONE = key -> Optional.empty();

    Optional<JsonNode> fetch(String key);
}
