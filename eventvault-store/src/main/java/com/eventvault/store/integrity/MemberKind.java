package com.eventvault.store.integrity;

/**
 * Constraint on the members of a container: array elements, or the values
 * of a keyed object.
 */
public enum MemberKind {
    /** No constraint. */
    ANY,
    /** Actor identifier: numeric id or alias string, normalised to an alias. */
    IDENTIFIER,
    /** Plain string; other scalars are stringified. */
    STRING
}
