package com.e2eq.atlas.core;

/**
 * An edge followed during a traversal, recorded under its source node.
 */
public record TraversalEdge(RelationType relation, String targetId, EntityType targetType) {

    public NodeKey targetKey() {
        return new NodeKey(targetType, targetId);
    }
}
