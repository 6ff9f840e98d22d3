package com.e2eq.atlas.core;

import io.quarkus.logging.Log;

import java.util.*;

/**
 * Static registry of the attributes that encode outgoing relationships.
 * <p>
 * For an entity the table yields the edges of every rule registered for its type, followed by
 * the edges of the type independent rules. Within a rule, ids keep their attribute order.
 * Ids that do not resolve against the {@link EntityIndex} are dropped.
 * </p>
 * <p>
 * New relationships are added by registering rules; traversal code never changes.
 * </p>
 */
public final class EdgeDerivationTable {

    private final Map<EntityType, List<EdgeRule>> rulesByType;
    private final List<EdgeRule> globalRules;

    private EdgeDerivationTable(Map<EntityType, List<EdgeRule>> rulesByType, List<EdgeRule> globalRules) {
        Map<EntityType, List<EdgeRule>> copy = new EnumMap<>(EntityType.class);
        rulesByType.forEach((type, rules) -> copy.put(type, List.copyOf(rules)));
        this.rulesByType = Collections.unmodifiableMap(copy);
        this.globalRules = List.copyOf(globalRules);
    }

    /**
     * Rules applied to an entity of the given type, in evaluation order.
     */
    public List<EdgeRule> rulesFor(EntityType type) {
        List<EdgeRule> typed = rulesByType.getOrDefault(type, List.of());
        if (globalRules.isEmpty()) {
            return typed;
        }
        List<EdgeRule> all = new ArrayList<>(typed.size() + globalRules.size());
        all.addAll(typed);
        all.addAll(globalRules);
        return all;
    }

    /** Every rule, type specific ones first. */
    public List<EdgeRule> rules() {
        List<EdgeRule> all = new ArrayList<>();
        rulesByType.values().forEach(all::addAll);
        all.addAll(globalRules);
        return Collections.unmodifiableList(all);
    }

    public List<DerivedEdge> deriveEdges(EntityRecord entity, EntityIndex index) {
        List<DerivedEdge> edges = new ArrayList<>();
        for (EdgeRule rule : rulesFor(entity.type())) {
            for (String targetId : entity.referenceIds(rule.attribute())) {
                Optional<EntityRecord> target = index.lookup(rule.targetType(), targetId);
                if (target.isPresent()) {
                    edges.add(new DerivedEdge(rule.relation(), targetId, rule.targetType(), target.get()));
                } else if (Log.isDebugEnabled()) {
                    Log.debugf("Dropping dangling %s reference %s -> %s:%s",
                            rule.relation().label(), entity, rule.targetType().label(), targetId);
                }
            }
        }
        return edges;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EdgeDerivationTable empty() {
        return builder().build();
    }

    /**
     * Relationship attributes of the atlas ontology.
     */
    public static EdgeDerivationTable atlasDefaults() {
        Builder b = builder();

        // Task -> capability / intrinsic
        b.rule(EntityType.AI_TASK, "requiresCapability", RelationType.REQUIRES_CAPABILITY, EntityType.CAPABILITY);
        b.rule(EntityType.AI_TASK, "hasRelatedLLMIntrinsic", RelationType.HAS_RELATED_LLMINTRINSIC, EntityType.LLM_INTRINSIC);

        // Capability -> task, adapter, intrinsic (inverse attributes written by the mapping import)
        b.rule(EntityType.CAPABILITY, "requiredByTask", RelationType.REQUIRED_BY_TASK, EntityType.AI_TASK);
        b.rule(EntityType.CAPABILITY, "implementedByAdapter", RelationType.IMPLEMENTED_BY_ADAPTER, EntityType.ADAPTER);
        b.rule(EntityType.CAPABILITY, "implementedByIntrinsic", RelationType.IMPLEMENTED_BY_INTRINSIC, EntityType.LLM_INTRINSIC);
        b.rule(EntityType.CAPABILITY, "isPartOf", RelationType.IS_PART_OF, EntityType.CAPABILITY_GROUP);
        skos(b, EntityType.CAPABILITY);

        b.rule(EntityType.ADAPTER, "implementsCapability_adapter", RelationType.IMPLEMENTS_CAPABILITY, EntityType.CAPABILITY);
        b.rule(EntityType.LLM_INTRINSIC, "implementsCapability_intrinsic", RelationType.IMPLEMENTS_CAPABILITY, EntityType.CAPABILITY);

        // Capability hierarchy
        b.rule(EntityType.CAPABILITY_GROUP, "hasPart", RelationType.HAS_PART, EntityType.CAPABILITY);
        b.rule(EntityType.CAPABILITY_GROUP, "belongsToDomain", RelationType.BELONGS_TO_DOMAIN, EntityType.CAPABILITY_DOMAIN);
        b.rule(EntityType.CAPABILITY_DOMAIN, "hasPart", RelationType.HAS_PART, EntityType.CAPABILITY_GROUP);

        // Risks
        b.rule(EntityType.RISK, "hasRelatedAction", RelationType.HAS_RELATED_ACTION, EntityType.ACTION);
        b.rule(EntityType.RISK, "isDetectedBy", RelationType.IS_DETECTED_BY, EntityType.RISK_CONTROL);
        skos(b, EntityType.RISK);

        b.rule(EntityType.POLICY, "hasRule", RelationType.HAS_RULE, EntityType.RULE);

        b.globalRule("hasDocumentation", RelationType.HAS_DOCUMENTATION, EntityType.DOCUMENT);
        b.globalRule("hasLicense", RelationType.HAS_LICENSE, EntityType.LICENSE);
        return b.build();
    }

    private static void skos(Builder b, EntityType type) {
        for (RelationType relation : RelationType.SKOS_MATCHES) {
            b.rule(type, relation.label(), relation, type);
        }
    }

    public static final class Builder {
        private final Map<EntityType, List<EdgeRule>> rulesByType = new EnumMap<>(EntityType.class);
        private final List<EdgeRule> globalRules = new ArrayList<>();

        private Builder() {}

        public Builder rule(EntityType sourceType, String attribute, RelationType relation, EntityType targetType) {
            return add(new EdgeRule(sourceType, attribute, relation, targetType));
        }

        public Builder globalRule(String attribute, RelationType relation, EntityType targetType) {
            return add(EdgeRule.global(attribute, relation, targetType));
        }

        /**
         * Registers a rule. Registering the same rule twice keeps the first registration.
         */
        public Builder add(EdgeRule rule) {
            List<EdgeRule> target = rule.isTypeIndependent()
                    ? globalRules
                    : rulesByType.computeIfAbsent(rule.sourceType(), k -> new ArrayList<>());
            if (!target.contains(rule)) {
                target.add(rule);
            }
            return this;
        }

        public Builder addAll(EdgeDerivationTable table) {
            table.rules().forEach(this::add);
            return this;
        }

        public EdgeDerivationTable build() {
            return new EdgeDerivationTable(rulesByType, globalRules);
        }
    }
}
