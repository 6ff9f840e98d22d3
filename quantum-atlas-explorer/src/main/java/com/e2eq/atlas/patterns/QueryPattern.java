package com.e2eq.atlas.patterns;

import com.e2eq.atlas.core.TraversalPolicy;

import java.util.Objects;

/**
 * A named, described traversal policy.
 */
public record QueryPattern(String name, String description, TraversalPolicy policy) {
    public QueryPattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(policy, "policy");
        description = description == null ? "" : description;
    }
}
