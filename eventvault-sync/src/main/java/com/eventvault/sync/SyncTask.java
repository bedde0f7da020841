package com.eventvault.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A pending mirror write: the document of a resource as it was saved.
 *
 * @param key        resource key
 * @param snapshot   private copy of the saved document
 * @param enqueuedAt when the save happened
 */
public record SyncTask(String key, JsonNode snapshot, Instant enqueuedAt) {
}
