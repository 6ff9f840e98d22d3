package com.e2eq.atlas.core;

import java.util.Objects;

/**
 * Declares that an attribute of {@code sourceType} entities holds ids of {@code targetType}
 * entities, reached over {@code relation}. A {@code null} source type makes the rule apply
 * to every entity type.
 */
public record EdgeRule(EntityType sourceType, String attribute, RelationType relation, EntityType targetType) {

    public EdgeRule {
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("Edge rule attribute must be provided");
        }
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(targetType, "targetType");
    }

    public static EdgeRule global(String attribute, RelationType relation, EntityType targetType) {
        return new EdgeRule(null, attribute, relation, targetType);
    }

    public boolean isTypeIndependent() {
        return sourceType == null;
    }
}
