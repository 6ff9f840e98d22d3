package com.e2eq.atlas.core;

import java.util.List;
import java.util.Objects;

/**
 * A node discovered by one traversal.
 *
 * @param id     entity id
 * @param type   entity type
 * @param entity the entity record; shared with the snapshot, never copied
 * @param depth  distance from the start node, which has depth 0
 * @param path   relationships followed from the start node to reach this node
 * @param parent key of the node this one was discovered from, {@code null} for the start node
 */
public record TraversalNode(String id, EntityType type, EntityRecord entity, int depth,
                            List<RelationType> path, NodeKey parent) {

    public TraversalNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        path = path == null ? List.of() : List.copyOf(path);
    }

    static TraversalNode start(EntityRecord entity) {
        return new TraversalNode(entity.id(), entity.type(), entity, 0, List.of(), null);
    }

    public NodeKey key() {
        return new NodeKey(type, id);
    }

    public String parentId() {
        return parent == null ? null : parent.id();
    }

    public boolean isStart() {
        return parent == null && depth == 0;
    }
}
