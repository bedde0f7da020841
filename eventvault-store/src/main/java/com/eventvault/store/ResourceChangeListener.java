package com.eventvault.store;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Notified after a resource has been durably replaced. Called on the saving
 * thread while it still holds the resource lock, so saves of one key are seen
 * in the order they were written; implementations must not block.
 */
@FunctionalInterface
public interface ResourceChangeListener {

    /**
     * @param key      resource key
     * @param snapshot private copy of the saved document
     */
    void onResourceSaved(String key, JsonNode snapshot);
}
