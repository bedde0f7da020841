package com.eventvault.store.integrity;

import com.eventvault.store.ResourceJson;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative shape of a resource document, consulted only by the
 * {@link IntegrityValidator}.
 */
public final class ResourceSchema {

    private final NodeKind container;
    private final MemberKind members;
    private final boolean actorKeyed;
    private final List<FieldSpec> fields;

    private ResourceSchema(NodeKind container, MemberKind members, boolean actorKeyed, List<FieldSpec> fields) {
        this.container = container;
        this.members = members;
        this.actorKeyed = actorKeyed;
        this.fields = List.copyOf(fields);
    }

    /** An object with required fields; undeclared entries are left alone. */
    public static Builder object() {
        return new Builder(NodeKind.OBJECT, MemberKind.ANY, false);
    }

    /** An object keyed by actor id whose values obey {@code values}. */
    public static ResourceSchema actorMap(MemberKind values) {
        return new ResourceSchema(NodeKind.OBJECT, values, true, List.of());
    }

    /** An object whose every value obeys {@code values}. */
    public static ResourceSchema map(MemberKind values) {
        return new ResourceSchema(NodeKind.OBJECT, values, false, List.of());
    }

    public static ResourceSchema array(MemberKind elements) {
        return new ResourceSchema(NodeKind.ARRAY, elements, false, List.of());
    }

    public static ResourceSchema scalar(NodeKind kind) {
        return new ResourceSchema(kind, MemberKind.ANY, false, List.of());
    }

    public NodeKind container() {
        return container;
    }

    public MemberKind members() {
        return members;
    }

    public boolean actorKeyed() {
        return actorKeyed;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    public static final class Builder {
        private final NodeKind container;
        private final MemberKind members;
        private final boolean actorKeyed;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(NodeKind container, MemberKind members, boolean actorKeyed) {
            this.container = container;
            this.members = members;
            this.actorKeyed = actorKeyed;
        }

        public Builder field(String name, NodeKind kind, String defaultJson) {
            return field(name, kind, MemberKind.ANY, defaultJson);
        }

        public Builder field(String name, NodeKind kind, MemberKind members, String defaultJson) {
            fields.add(new FieldSpec(name, kind, members, ResourceJson.parse(defaultJson)));
            return this;
        }

        public ResourceSchema build() {
            return new ResourceSchema(container, members, actorKeyed, fields);
        }
    }
}
