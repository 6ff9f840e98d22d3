package com.e2eq.atlas.core;

import java.util.Objects;

/**
 * Identity of a graph node. Ids are only unique within a type, so the type is part of the key.
 */
public record NodeKey(EntityType type, String id) {

    public NodeKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return type.label() + ":" + id;
    }
}
