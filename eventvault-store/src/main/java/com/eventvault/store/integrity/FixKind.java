package com.eventvault.store.integrity;

public enum FixKind {
    /** Resource was absent and its default was written. */
    CREATED,
    /** Resource was absent locally and was taken from the mirror. */
    RESTORED_FROM_MIRROR,
    /** Resource did not parse; it was quarantined and reset to default. */
    RESET_CORRUPTED,
    /** Resource had the wrong container type and was reset to default. */
    RESET_SHAPE,
    /** A required field was missing and was added with its default. */
    ADDED_FIELD,
    /** A required field had the wrong kind and was reset to its default. */
    RESET_FIELD,
    /** A value was converted in place to the expected kind. */
    COERCED,
    /** An entry that could not be salvaged was removed. */
    DROPPED,
    /** A newly resolved alias was recorded in the alias map. */
    LEARNED_ALIAS
}
