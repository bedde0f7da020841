package com.eventvault.store;

import com.eventvault.store.integrity.MemberKind;
import com.eventvault.store.integrity.NodeKind;
import com.eventvault.store.integrity.ResourceSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The set of resources the store knows about. Iteration order is declaration
 * order; {@link #ALIAS_MAP} comes before the rosters that resolve through it.
 */
@Slf4j
public final class ResourceCatalog {

    public static final String ALIAS_MAP = "alias-map";
    public static final String EVENTS = "events";
    public static final String BLOCKED_ACTORS = "blocked-actors";
    public static final String ABSENT_ACTORS = "absent-actors";
    public static final String RESULTS = "results";
    public static final String EVENTS_HISTORY = "events-history";
    public static final String PLAYER_STATS = "player-stats";
    public static final String EVENT_TIMES = "event-times";
    public static final String SIGNUP_LOCK = "signup-lock";
    public static final String NOTIFICATION_PREFS = "notification-prefs";
    public static final String MATCH_STATS = "match-stats";

    public static final List<String> TEAMS = List.of("main_team", "team_2", "team_3");

    private final Map<String, ResourceDefinition> definitions;

    private ResourceCatalog(Map<String, ResourceDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static ResourceCatalog of(Collection<ResourceDefinition> definitions) {
        Map<String, ResourceDefinition> byKey = new LinkedHashMap<>();
        for (ResourceDefinition def : definitions) {
            if (byKey.put(def.key(), def) != null) {
                throw new IllegalArgumentException("Duplicate resource key: " + def.key());
            }
        }
        return new ResourceCatalog(byKey);
    }

    /**
     * The resources of the community-event bot.
     */
    public static ResourceCatalog standard() {
        ResourceSchema.Builder events = ResourceSchema.object();
        for (String team : TEAMS) {
            events.field(team, NodeKind.ARRAY, MemberKind.IDENTIFIER, "[]");
        }
        return of(List.of(
                define(ALIAS_MAP, "ign_map.json", "{}",
                        ResourceSchema.actorMap(MemberKind.STRING)),
                define(EVENTS, "events.json", "{\"main_team\":[],\"team_2\":[],\"team_3\":[]}",
                        events.build()),
                define(BLOCKED_ACTORS, "blocked_users.json", "{}",
                        ResourceSchema.actorMap(MemberKind.ANY)),
                define(ABSENT_ACTORS, "absent_users.json", "{}",
                        ResourceSchema.actorMap(MemberKind.ANY)),
                define(RESULTS, "event_results.json", "{\"total_wins\":0,\"total_losses\":0,\"history\":[]}",
                        ResourceSchema.object()
                                .field("total_wins", NodeKind.NUMBER, "0")
                                .field("total_losses", NodeKind.NUMBER, "0")
                                .field("history", NodeKind.ARRAY, "[]")
                                .build()),
                define(EVENTS_HISTORY, "events_history.json", "[]",
                        ResourceSchema.array(MemberKind.ANY)),
                define(PLAYER_STATS, "player_stats.json", "{}",
                        ResourceSchema.actorMap(MemberKind.ANY)),
                define(EVENT_TIMES, "row_times.json",
                        "{\"main_team\":\"20:00 UTC Sunday\",\"team_2\":\"20:00 UTC Saturday\","
                                + "\"team_3\":\"14:00 UTC Sunday\"}",
                        ResourceSchema.map(MemberKind.STRING)),
                define(SIGNUP_LOCK, "signup_lock.json", "false",
                        ResourceSchema.scalar(NodeKind.BOOLEAN)),
                define(NOTIFICATION_PREFS, "notification_preferences.json",
                        "{\"users\":{},\"default_settings\":{}}",
                        ResourceSchema.object()
                                .field("users", NodeKind.OBJECT, "{}")
                                .field("default_settings", NodeKind.OBJECT, "{}")
                                .build()),
                define(MATCH_STATS, "match_statistics.json", "{\"matches\":[]}",
                        ResourceSchema.object()
                                .field("matches", NodeKind.ARRAY, "[]")
                                .build())));
    }

    private static ResourceDefinition define(String key, String fileName, String defaultJson, ResourceSchema schema) {
        return new ResourceDefinition(key, fileName, ResourceJson.parse(defaultJson), schema);
    }

    /**
     * Replace documented defaults with configured ones. Unknown keys are
     * ignored with a warning; an override whose kind does not fit the
     * resource's schema is rejected.
     */
    public ResourceCatalog withDefaultOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, ResourceDefinition> copy = new LinkedHashMap<>(definitions);
        overrides.forEach((key, value) -> {
            ResourceDefinition def = copy.get(key);
            if (def == null) {
                log.warn("Ignoring default override for undeclared resource: {}", key);
                return;
            }
            var node = ResourceJson.valueToTree(value);
            if (!def.schema().container().matches(node)) {
                throw new IllegalArgumentException("Default override for " + key
                        + " must be " + def.schema().container() + " but was " + NodeKind.describe(node));
            }
            copy.put(key, def.withDefault(node));
        });
        return new ResourceCatalog(copy);
    }

    /**
     * @throws StoreException if the key is not declared
     */
    public ResourceDefinition get(String key) {
        ResourceDefinition def = definitions.get(key);
        if (def == null) {
            throw new StoreException("Undeclared resource: " + key);
        }
        return def;
    }

    public boolean contains(String key) {
        return definitions.containsKey(key);
    }

    public Collection<ResourceDefinition> all() {
        return definitions.values();
    }

    public List<String> keys() {
        return List.copyOf(definitions.keySet());
    }
}
