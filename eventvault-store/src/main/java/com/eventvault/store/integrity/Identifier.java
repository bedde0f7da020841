package com.eventvault.store.integrity;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A roster member as found on disk: either a raw numeric actor id or an
 * alias (display name). Anything else is not an identifier.
 */
public sealed interface Identifier permits Identifier.NumericId, Identifier.Alias, Identifier.Invalid {

    record NumericId(long id) implements Identifier {
    }

    record Alias(String alias) implements Identifier {
    }

    record Invalid(String foundKind) implements Identifier {
    }

    static Identifier parse(JsonNode node) {
        if (node == null) {
            return new Invalid("null");
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return new NumericId(node.asLong());
        }
        if (node.isTextual()) {
            return new Alias(node.asText());
        }
        return new Invalid(NodeKind.describe(node));
    }
}
