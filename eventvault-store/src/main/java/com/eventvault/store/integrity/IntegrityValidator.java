package com.eventvault.store.integrity;

import com.eventvault.store.ReadResult;
import com.eventvault.store.ResourceCatalog;
import com.eventvault.store.ResourceDefinition;
import com.eventvault.store.ResourceStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Startup integrity check: makes every declared resource exist and match its
 * {@link ResourceSchema}, repairing in place where data can be kept and
 * resetting to the documented default where it cannot.
 * <p>
 * Repaired documents are written back through {@link ResourceStore#save}, so
 * the usual atomic-replace and {@code .bak} guarantees apply. A second run on
 * the same directory produces an empty {@link FixReport}.
 */
@Slf4j
public class IntegrityValidator {

    static final int MIN_ALIAS_LENGTH = 2;
    static final String PLACEHOLDER_PREFIX = "User_";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ResourceStore store;
    private final BootstrapSource bootstrap;
    private final DisplayNameResolver displayNames;

    public IntegrityValidator(ResourceStore store) {
        this(store, BootstrapSource.NONE, DisplayNameResolver.NONE);
    }

    public IntegrityValidator(ResourceStore store, BootstrapSource bootstrap, DisplayNameResolver displayNames) {
        this.store = store;
        this.bootstrap = bootstrap != null ? bootstrap : BootstrapSource.NONE;
        this.displayNames = displayNames != null ? displayNames : DisplayNameResolver.NONE;
    }

    /**
     * Check and repair every declared resource.
     */
    public FixReport run() {
        log.info("Running startup integrity check on {}", store.getDataDir());
        FixReport report = new FixReport();
        RepairContext ctx = new RepairContext();

        for (ResourceDefinition def : store.getCatalog().all()) {
            try {
                JsonNode finalDoc = checkResource(def, ctx, report);
                if (ResourceCatalog.ALIAS_MAP.equals(def.key()) && finalDoc instanceof ObjectNode aliases) {
                    ctx.aliases = aliases;
                }
            } catch (RuntimeException e) {
                log.error("Integrity check failed for {}: {}", def.key(), e.getMessage(), e);
            }
        }

        if (!ctx.learned.isEmpty() && store.getCatalog().contains(ResourceCatalog.ALIAS_MAP)) {
            persistLearnedAliases(ctx, report);
        }

        report.log();
        return report;
    }

    private JsonNode checkResource(ResourceDefinition def, RepairContext ctx, FixReport report) {
        String key = def.key();
        ReadResult read = store.read(key);
        switch (read.status()) {
            case ABSENT:
                return restoreOrCreate(def, ctx, report);
            case CORRUPT: {
                JsonNode fresh = def.newDefault();
                if (store.save(key, fresh)) {
                    String where = read.quarantinedTo() != null
                            ? " (original kept as " + read.quarantinedTo().getFileName() + ")"
                            : "";
                    report.add(new Fix(key, FixKind.RESET_CORRUPTED, "Reset corrupted resource" + where));
                } else {
                    log.error("Could not reset corrupted resource {}", key);
                }
                return fresh;
            }
            case FAILED:
                log.warn("Skipping {}: file exists but cannot be read, left in place", key);
                return null;
            case OK:
            default: {
                List<Fix> fixes = new ArrayList<>();
                JsonNode repaired = repair(def, read.value(), ctx, fixes);
                if (fixes.isEmpty()) {
                    return repaired;
                }
                if (store.save(key, repaired)) {
                    report.addAll(fixes);
                } else {
                    log.error("Could not save {} repaired entries for {}", fixes.size(), key);
                }
                return repaired;
            }
        }
    }

    private JsonNode restoreOrCreate(ResourceDefinition def, RepairContext ctx, FixReport report) {
        String key = def.key();
        Optional<JsonNode> mirrored = bootstrap.fetch(key);
        if (mirrored.isPresent()) {
            List<Fix> fixes = new ArrayList<>();
            JsonNode repaired = repair(def, mirrored.get().deepCopy(), ctx, fixes);
            // The mirror already holds this document; no need to push it back.
            if (store.save(key, repaired, false)) {
                report.add(new Fix(key, FixKind.RESTORED_FROM_MIRROR, "Restored missing resource from mirror"));
                report.addAll(fixes);
                return repaired;
            }
            log.error("Could not save mirrored copy of {}", key);
        }
        JsonNode fresh = def.newDefault();
        if (store.save(key, fresh)) {
            report.add(new Fix(key, FixKind.CREATED, "Created missing resource " + def.fileName()));
        } else {
            log.error("Could not create missing resource {}", key);
        }
        return fresh;
    }

    // ── Repair ─────────────────────────────────────────────────────────

    JsonNode repair(ResourceDefinition def, JsonNode doc, RepairContext ctx, List<Fix> fixes) {
        ResourceSchema schema = def.schema();
        String key = def.key();
        if (!schema.container().matches(doc)) {
            JsonNode coerced = coerceScalar(schema.container(), doc);
            if (coerced != null) {
                fixes.add(new Fix(key, FixKind.COERCED,
                        "Converted " + NodeKind.describe(doc) + " " + doc + " to " + coerced));
                return coerced;
            }
            fixes.add(new Fix(key, FixKind.RESET_SHAPE, "Expected " + describe(schema.container())
                    + " but found " + NodeKind.describe(doc) + ", reset to default"));
            return def.newDefault();
        }
        if (doc instanceof ObjectNode object) {
            repairObject(key, schema, object, ctx, fixes);
        } else if (doc instanceof ArrayNode array) {
            repairMembers(key, key, array, schema.members(), ctx, fixes);
        }
        return doc;
    }

    private void repairObject(String key, ResourceSchema schema, ObjectNode object, RepairContext ctx,
            List<Fix> fixes) {
        if (schema.actorKeyed()) {
            normalizeActorKeys(key, object, fixes);
        }
        for (FieldSpec field : schema.fields()) {
            String label = key + "." + field.name();
            JsonNode value = object.get(field.name());
            if (value == null) {
                object.set(field.name(), field.newDefault());
                fixes.add(new Fix(key, FixKind.ADDED_FIELD, "Added missing field '" + field.name() + "'"));
                continue;
            }
            if (!field.kind().matches(value)) {
                JsonNode coerced = coerceScalar(field.kind(), value);
                if (coerced != null) {
                    object.set(field.name(), coerced);
                    fixes.add(new Fix(key, FixKind.COERCED,
                            "Converted " + label + " from " + value + " to " + coerced));
                } else {
                    object.set(field.name(), field.newDefault());
                    fixes.add(new Fix(key, FixKind.RESET_FIELD, "Field '" + field.name() + "' expected "
                            + describe(field.kind()) + " but found " + NodeKind.describe(value)));
                }
                continue;
            }
            if (field.members() != MemberKind.ANY) {
                if (value instanceof ArrayNode array) {
                    repairMembers(key, label, array, field.members(), ctx, fixes);
                } else if (value instanceof ObjectNode nested) {
                    repairValues(key, label, nested, field.members(), ctx, fixes);
                }
            }
        }
        if (schema.members() != MemberKind.ANY) {
            repairValues(key, key, object, schema.members(), ctx, fixes);
        }
    }

    private void normalizeActorKeys(String key, ObjectNode object, List<Fix> fixes) {
        Map<String, JsonNode> normalized = new LinkedHashMap<>();
        boolean changed = false;
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String rawKey = entry.getKey();
            String trimmed = rawKey.trim();
            if (trimmed.isEmpty()) {
                fixes.add(new Fix(key, FixKind.DROPPED, "Removed entry with blank actor id"));
                changed = true;
            } else if (normalized.containsKey(trimmed)) {
                fixes.add(new Fix(key, FixKind.DROPPED, "Removed duplicate entry for actor id '" + trimmed + "'"));
                changed = true;
            } else {
                if (!trimmed.equals(rawKey)) {
                    fixes.add(new Fix(key, FixKind.COERCED, "Trimmed actor id '" + rawKey + "'"));
                    changed = true;
                }
                normalized.put(trimmed, entry.getValue());
            }
        }
        if (changed) {
            object.removeAll();
            object.setAll(normalized);
        }
    }

    private void repairValues(String key, String label, ObjectNode object, MemberKind kind, RepairContext ctx,
            List<Fix> fixes) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        for (String name : names) {
            JsonNode fixed = repairMember(key, label + "." + name, object.get(name), kind, ctx, fixes);
            if (fixed == null) {
                object.remove(name);
            } else if (fixed != object.get(name)) {
                object.set(name, fixed);
            }
        }
    }

    private void repairMembers(String key, String label, ArrayNode array, MemberKind kind, RepairContext ctx,
            List<Fix> fixes) {
        if (kind == MemberKind.ANY) {
            return;
        }
        List<JsonNode> kept = new ArrayList<>(array.size());
        boolean changed = false;
        for (JsonNode member : array) {
            JsonNode fixed = repairMember(key, label, member, kind, ctx, fixes);
            if (fixed != member) {
                changed = true;
            }
            if (fixed != null) {
                kept.add(fixed);
            }
        }
        if (changed) {
            array.removeAll();
            array.addAll(kept);
        }
    }

    /**
     * @return the member unchanged (same instance), a replacement, or
     *         {@code null} to drop it
     */
    private JsonNode repairMember(String key, String label, JsonNode member, MemberKind kind, RepairContext ctx,
            List<Fix> fixes) {
        switch (kind) {
            case IDENTIFIER:
                return repairIdentifier(key, label, member, ctx, fixes);
            case STRING:
                if (member.isTextual()) {
                    return member;
                }
                if (member.isValueNode() && !member.isNull()) {
                    fixes.add(new Fix(key, FixKind.COERCED,
                            "Converted " + NodeKind.describe(member) + " " + member + " in " + label + " to string"));
                    return NODES.textNode(member.asText());
                }
                fixes.add(new Fix(key, FixKind.DROPPED,
                        "Removed " + NodeKind.describe(member) + " from " + label + " (expected string)"));
                return null;
            case ANY:
            default:
                return member;
        }
    }

    private JsonNode repairIdentifier(String key, String label, JsonNode member, RepairContext ctx,
            List<Fix> fixes) {
        Identifier id = Identifier.parse(member);
        if (id instanceof Identifier.Alias alias) {
            String cleaned = alias.alias().trim();
            if (cleaned.length() < MIN_ALIAS_LENGTH) {
                fixes.add(new Fix(key, FixKind.DROPPED, "Removed invalid alias '" + alias.alias() + "' from " + label));
                return null;
            }
            if (!cleaned.equals(alias.alias())) {
                fixes.add(new Fix(key, FixKind.COERCED,
                        "Cleaned alias '" + alias.alias() + "' -> '" + cleaned + "' in " + label));
                return NODES.textNode(cleaned);
            }
            return member;
        }
        if (id instanceof Identifier.NumericId numeric) {
            String resolved = resolveAlias(numeric.id(), ctx);
            if (resolved != null) {
                fixes.add(new Fix(key, FixKind.COERCED,
                        "Converted actor id " + numeric.id() + " to alias '" + resolved + "' in " + label));
                return NODES.textNode(resolved);
            }
            String placeholder = PLACEHOLDER_PREFIX + numeric.id();
            fixes.add(new Fix(key, FixKind.COERCED,
                    "Converted unknown actor id " + numeric.id() + " to placeholder in " + label));
            return NODES.textNode(placeholder);
        }
        Identifier.Invalid invalid = (Identifier.Invalid) id;
        fixes.add(new Fix(key, FixKind.DROPPED,
                "Removed invalid member type " + invalid.foundKind() + " from " + label));
        return null;
    }

    private String resolveAlias(long actorId, RepairContext ctx) {
        String idKey = Long.toString(actorId);
        String known = ctx.learned.get(idKey);
        if (known != null) {
            return known;
        }
        if (ctx.aliases != null) {
            JsonNode mapped = ctx.aliases.get(idKey);
            if (mapped != null && mapped.isTextual() && mapped.asText().trim().length() >= MIN_ALIAS_LENGTH) {
                return mapped.asText().trim();
            }
        }
        Optional<String> fromPlatform = displayNames.resolve(actorId);
        if (fromPlatform.isPresent()) {
            String name = fromPlatform.get().trim();
            if (name.length() >= MIN_ALIAS_LENGTH) {
                ctx.learned.put(idKey, name);
                return name;
            }
        }
        return null;
    }

    private void persistLearnedAliases(RepairContext ctx, FixReport report) {
        Optional<JsonNode> saved = store.update(ResourceCatalog.ALIAS_MAP, null, doc -> {
            ObjectNode aliases = doc instanceof ObjectNode object ? object : NODES.objectNode();
            ctx.learned.forEach(aliases::put);
            return aliases;
        });
        if (saved.isEmpty()) {
            log.error("Could not record {} learned alias(es)", ctx.learned.size());
            return;
        }
        ctx.learned.forEach((id, alias) -> report.add(new Fix(ResourceCatalog.ALIAS_MAP, FixKind.LEARNED_ALIAS,
                "Added alias mapping " + id + " -> " + alias)));
    }

    static JsonNode coerceScalar(NodeKind expected, JsonNode value) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        String text = value.asText().trim();
        if (expected == NodeKind.NUMBER) {
            try {
                BigDecimal number = new BigDecimal(text);
                if (number.scale() <= 0 || number.stripTrailingZeros().scale() <= 0) {
                    long asLong = number.longValueExact();
                    return asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE
                            ? NODES.numberNode((int) asLong)
                            : NODES.numberNode(asLong);
                }
                return NODES.numberNode(number.doubleValue());
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        if (expected == NodeKind.BOOLEAN) {
            if ("true".equalsIgnoreCase(text)) {
                return NODES.booleanNode(true);
            }
            if ("false".equalsIgnoreCase(text)) {
                return NODES.booleanNode(false);
            }
        }
        return null;
    }

    private static String describe(NodeKind kind) {
        return kind.name().toLowerCase();
    }

    static final class RepairContext {
        ObjectNode aliases;
        final Map<String, String> learned = new LinkedHashMap<>();
    }
}
