package com.eventvault.store.integrity;

/**
 * One repair applied to one resource.
 */
public record Fix(String resourceKey, FixKind kind, String description) {

    @Override
    public String toString() {
        return "[" + resourceKey + "] " + kind + ": " + description;
    }
}
