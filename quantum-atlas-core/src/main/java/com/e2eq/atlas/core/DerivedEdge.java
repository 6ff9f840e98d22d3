package com.e2eq.atlas.core;

/**
 * An outgoing edge computed from a relationship attribute, with its resolved target.
 */
public record DerivedEdge(RelationType relation, String targetId, EntityType targetType, EntityRecord target) {

    public NodeKey targetKey() {
        return new NodeKey(targetType, targetId);
    }
}
