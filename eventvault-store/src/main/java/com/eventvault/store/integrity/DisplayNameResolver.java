package com.eventvault.store.integrity;

import java.util.Optional;

/**
 * Looks up the current display name of a numeric actor id, typically from the
 * chat platform. Must not throw.
 */
@FunctionalInterface
public interface DisplayNameResolver {

    DisplayNameResolver NONE = id -> Optional.empty();

    Optional<String> resolve(long actorId);
}
