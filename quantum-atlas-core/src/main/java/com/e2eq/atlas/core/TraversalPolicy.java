package com.e2eq.atlas.core;

import com.e2eq.atlas.exceptions.InvalidTraversalPolicyException;

import java.util.*;

/**
 * Immutable filtering and depth configuration of one breadth-first traversal.
 * <p>
 * Empty include/exclude sets mean "no restriction". When a value appears in both the
 * include and the exclude set of the same kind, exclusion wins.
 * </p>
 *
 * @param maxDepth              deepest level that is expanded; nodes at this depth are reported but not expanded
 * @param includedRelationships relationships that may be followed (empty = all)
 * @param excludedRelationships relationships that are never followed
 * @param includedEntityTypes   entity types reported in the result (empty = all)
 * @param excludedEntityTypes   entity types never reported
 * @param nodePropertyFilters   attribute values every reported node must carry (AND); null values allowed
 * @param followBidirectional   informational; direction always comes from the edge derivation table
 * @param deduplicateResults    whether an entity is enqueued at most once
 * @param maxResults            cap on reported nodes
 * @param cacheEnabled          whether the navigator may serve and store this query in its cache
 */
public record TraversalPolicy(
        int maxDepth,
        Set<RelationType> includedRelationships,
        Set<RelationType> excludedRelationships,
        Set<EntityType> includedEntityTypes,
        Set<EntityType> excludedEntityTypes,
        Map<String, Object> nodePropertyFilters,
        boolean followBidirectional,
        boolean deduplicateResults,
        OptionalInt maxResults,
        boolean cacheEnabled
) {

    public static final int DEFAULT_MAX_DEPTH = 2;

    public TraversalPolicy {
        if (maxDepth < 0) {
            throw new InvalidTraversalPolicyException("maxDepth", "must be >= 0 but was " + maxDepth);
        }
        maxResults = maxResults == null ? OptionalInt.empty() : maxResults;
        if (maxResults.isPresent() && maxResults.getAsInt() < 1) {
            throw new InvalidTraversalPolicyException("maxResults", "must be >= 1 but was " + maxResults.getAsInt());
        }
        includedRelationships = enumSet(includedRelationships, "includedRelationships");
        excludedRelationships = enumSet(excludedRelationships, "excludedRelationships");
        includedEntityTypes = enumSet(includedEntityTypes, "includedEntityTypes");
        excludedEntityTypes = enumSet(excludedEntityTypes, "excludedEntityTypes");

        if (nodePropertyFilters == null || nodePropertyFilters.isEmpty()) {
            nodePropertyFilters = Map.of();
        } else {
            for (String key : nodePropertyFilters.keySet()) {
                if (key == null || key.isBlank()) {
                    throw new InvalidTraversalPolicyException("nodePropertyFilters", "filter attribute names must not be blank");
                }
            }
            nodePropertyFilters = Collections.unmodifiableMap(new LinkedHashMap<>(nodePropertyFilters));
        }
    }

    private static <E extends Enum<E>> Set<E> enumSet(Set<E> values, String field) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        for (E value : values) {
            if (value == null) {
                throw new InvalidTraversalPolicyException(field, "must not contain null");
            }
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(values));
    }

    /** Policy with every default: depth 2, no filters, deduplication and caching on. */
    public static TraversalPolicy defaults() {
        return builder().build();
    }

    public boolean allowsRelationship(RelationType relation) {
        if (excludedRelationships.contains(relation)) {
            return false;
        }
        return includedRelationships.isEmpty() || includedRelationships.contains(relation);
    }

    public boolean allowsEntityType(EntityType type) {
        if (excludedEntityTypes.contains(type)) {
            return false;
        }
        return includedEntityTypes.isEmpty() || includedEntityTypes.contains(type);
    }

    /**
     * True when every filter attribute carries exactly the expected value. An absent attribute
     * reads as {@code null} and only satisfies a filter expecting {@code null}.
     */
    public boolean matchesNodeFilters(EntityRecord entity) {
        for (Map.Entry<String, Object> filter : nodePropertyFilters.entrySet()) {
            Object actual = entity == null ? null : entity.attribute(filter.getKey());
            if (!Objects.equals(actual, filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    public boolean isCapped() {
        return maxResults.isPresent();
    }

    /**
     * Deterministic key of a query with this policy from the given start entity.
     *
     * @see TraversalCacheKey
     */
    public TraversalCacheKey cacheKey(String startId, EntityType startType) {
        return TraversalCacheKey.of(startId, startType, this);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxDepth = maxDepth;
        b.includedRelationships.addAll(includedRelationships);
        b.excludedRelationships.addAll(excludedRelationships);
        b.includedEntityTypes.addAll(includedEntityTypes);
        b.excludedEntityTypes.addAll(excludedEntityTypes);
        b.nodePropertyFilters.putAll(nodePropertyFilters);
        b.followBidirectional = followBidirectional;
        b.deduplicateResults = deduplicateResults;
        b.maxResults = maxResults.isPresent() ? maxResults.getAsInt() : null;
        b.cacheEnabled = cacheEnabled;
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private final Set<RelationType> includedRelationships = new LinkedHashSet<>();
        private final Set<RelationType> excludedRelationships = new LinkedHashSet<>();
        private final Set<EntityType> includedEntityTypes = new LinkedHashSet<>();
        private final Set<EntityType> excludedEntityTypes = new LinkedHashSet<>();
        private final Map<String, Object> nodePropertyFilters = new LinkedHashMap<>();
        private boolean followBidirectional = true;
        private boolean deduplicateResults = true;
        private Integer maxResults;
        private boolean cacheEnabled = true;

        private Builder() {}

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder includeRelationships(RelationType... relations) {
            return includeRelationships(Arrays.asList(relations));
        }

        public Builder includeRelationships(Collection<RelationType> relations) {
            includedRelationships.addAll(relations);
            return this;
        }

        public Builder excludeRelationships(RelationType... relations) {
            return excludeRelationships(Arrays.asList(relations));
        }

        public Builder excludeRelationships(Collection<RelationType> relations) {
            excludedRelationships.addAll(relations);
            return this;
        }

        public Builder includeEntityTypes(EntityType... types) {
            return includeEntityTypes(Arrays.asList(types));
        }

        public Builder includeEntityTypes(Collection<EntityType> types) {
            includedEntityTypes.addAll(types);
            return this;
        }

        public Builder excludeEntityTypes(EntityType... types) {
            return excludeEntityTypes(Arrays.asList(types));
        }

        public Builder excludeEntityTypes(Collection<EntityType> types) {
            excludedEntityTypes.addAll(types);
            return this;
        }

        public Builder nodePropertyFilter(String attribute, Object expectedValue) {
            nodePropertyFilters.put(attribute, expectedValue);
            return this;
        }

        public Builder nodePropertyFilters(Map<String, ?> filters) {
            nodePropertyFilters.putAll(filters);
            return this;
        }

        public Builder followBidirectional(boolean followBidirectional) {
            this.followBidirectional = followBidirectional;
            return this;
        }

        public Builder deduplicateResults(boolean deduplicateResults) {
            this.deduplicateResults = deduplicateResults;
            return this;
        }

        /** @param maxResults cap on reported nodes, {@code null} for no cap */
        public Builder maxResults(Integer maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public TraversalPolicy build() {
            return new TraversalPolicy(
                    maxDepth,
                    includedRelationships,
                    excludedRelationships,
                    includedEntityTypes,
                    excludedEntityTypes,
                    nodePropertyFilters,
                    followBidirectional,
                    deduplicateResults,
                    maxResults == null ? OptionalInt.empty() : OptionalInt.of(maxResults),
                    cacheEnabled);
        }
    }
}
