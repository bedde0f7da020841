package com.eventvault.sync;

import com.eventvault.store.integrity.BootstrapSource;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Supplies locally missing resources from the mirror at startup. Any failure
 * means "no mirrored copy"; startup then falls back to defaults.
 */
@Slf4j
public class RemoteBootstrap implements BootstrapSource {

    private final RemoteConnector connector;

    public RemoteBootstrap(RemoteConnector connector) {
        this.connector = connector;
    }

    @Override
    public Optional<JsonNode> fetch(String key) {
        if (!connector.isConnected()) {
            log.debug("Mirror not reachable, no bootstrap copy of {}", key);
            return Optional.empty();
        }
        try {
            Optional<JsonNode> mirrored = connector.pull(key);
            mirrored.ifPresent(doc -> log.info("Found mirrored copy of missing resource {}", key));
            return mirrored;
        } catch (RemoteException e) {
            log.warn("Could not pull {} from mirror: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
