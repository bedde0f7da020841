package com.eventvault.sync;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Access to the remote tabular mirror. One table per resource key.
 * <p>
 * Implementations may block on network I/O; callers bound every call with a
 * timeout.
 */
public interface RemoteConnector {

    /**
     * Cheap connectivity probe. Must not throw.
     */
    boolean isConnected();

    /**
     * Replace the remote table for a resource with the whole document.
     */
    void push(String key, JsonNode document) throws RemoteException;

    /**
     * Write one batch of records. Batch {@code 0} replaces the table, later
     * batches append to it.
     */
    void pushBatch(String key, RecordBatch batch) throws RemoteException;

    /**
     * Read the mirrored document for a resource.
     *
     * @return empty if the mirror has no table for the key
     */
    Optional<JsonNode> pull(String key) throws RemoteException;

    /**
     * Short name for logs.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
