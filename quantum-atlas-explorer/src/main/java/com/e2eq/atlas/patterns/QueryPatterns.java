package com.e2eq.atlas.patterns;

import com.e2eq.atlas.core.EntityType;
import com.e2eq.atlas.core.RelationType;
import com.e2eq.atlas.core.TraversalPolicy;
import com.e2eq.atlas.exceptions.PolicyNotFoundException;

import java.util.*;

/**
 * Catalogue of named traversal policies for recurring questions over the atlas.
 * <p>
 * Lookups are plain map reads; the catalogue is fixed at class initialisation and kept in
 * declaration order.
 * </p>
 */
public final class QueryPatterns {

    public static final String CAPABILITIES_FOR_TASK = "capabilities_for_task";
    public static final String INTRINSICS_FOR_CAPABILITY = "intrinsics_for_capability";
    public static final String TASKS_FOR_CAPABILITY = "tasks_for_capability";
    public static final String CAPABILITY_HIERARCHY = "capability_hierarchy";
    public static final String END_TO_END_TASK_TO_INTRINSICS = "end_to_end_task_to_intrinsics";
    public static final String CONTROLS_FOR_RISK = "controls_for_risk";
    public static final String ACTIONS_FOR_RISK = "actions_for_risk";
    public static final String RELATED_RISKS = "related_risks";
    public static final String RISK_NEIGHBORHOOD = "risk_neighborhood";
    public static final String INTRINSICS_FOR_TASK = "intrinsics_for_task";
    public static final String DOCUMENTATION_FOR_ENTITY = "documentation_for_entity";
    public static final String SKOS_MATCHES = "skos_matches";

    private static final Map<String, QueryPattern> PATTERNS;

    static {
        Map<String, QueryPattern> m = new LinkedHashMap<>();

        // Capabilities
        register(m, CAPABILITIES_FOR_TASK, "Get all capabilities required by a specific AI task",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.REQUIRES_CAPABILITY)
                        .includeEntityTypes(EntityType.CAPABILITY));
        register(m, INTRINSICS_FOR_CAPABILITY, "Get all intrinsics/adapters that implement a capability",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.IMPLEMENTED_BY_INTRINSIC, RelationType.IMPLEMENTED_BY_ADAPTER)
                        .includeEntityTypes(EntityType.LLM_INTRINSIC, EntityType.ADAPTER));
        register(m, TASKS_FOR_CAPABILITY, "Get all tasks that require a capability",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.REQUIRED_BY_TASK)
                        .includeEntityTypes(EntityType.AI_TASK));
        register(m, CAPABILITY_HIERARCHY, "Get the full capability hierarchy (domain -> groups -> capabilities)",
                TraversalPolicy.builder().maxDepth(2)
                        .includeRelationships(RelationType.HAS_PART, RelationType.IS_PART_OF, RelationType.BELONGS_TO_DOMAIN)
                        .includeEntityTypes(EntityType.CAPABILITY_DOMAIN, EntityType.CAPABILITY_GROUP, EntityType.CAPABILITY));
        register(m, END_TO_END_TASK_TO_INTRINSICS, "Complete path: task -> capabilities -> intrinsics",
                TraversalPolicy.builder().maxDepth(2)
                        .includeRelationships(RelationType.REQUIRES_CAPABILITY,
                                RelationType.IMPLEMENTED_BY_INTRINSIC, RelationType.IMPLEMENTED_BY_ADAPTER)
                        .includeEntityTypes(EntityType.CAPABILITY, EntityType.LLM_INTRINSIC, EntityType.ADAPTER));

        // Risks
        register(m, CONTROLS_FOR_RISK, "Get all controls that detect a specific risk",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.IS_DETECTED_BY)
                        .includeEntityTypes(EntityType.RISK_CONTROL));
        register(m, ACTIONS_FOR_RISK, "Get all actions for a specific risk",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.HAS_RELATED_ACTION)
                        .includeEntityTypes(EntityType.ACTION));
        register(m, RELATED_RISKS, "Get all risks related via SKOS relationships",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.SKOS_MATCHES)
                        .includeEntityTypes(EntityType.RISK));
        List<RelationType> neighborhood = new ArrayList<>(List.of(RelationType.IS_DETECTED_BY, RelationType.HAS_RELATED_ACTION));
        neighborhood.addAll(RelationType.SKOS_MATCHES);
        register(m, RISK_NEIGHBORHOOD, "Comprehensive neighborhood of a risk (controls, actions, related risks)",
                TraversalPolicy.builder().maxDepth(2)
                        .includeRelationships(neighborhood)
                        .includeEntityTypes(EntityType.RISK_CONTROL, EntityType.ACTION, EntityType.RISK));

        register(m, INTRINSICS_FOR_TASK, "Get intrinsics related to a task",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.HAS_RELATED_LLMINTRINSIC)
                        .includeEntityTypes(EntityType.LLM_INTRINSIC));
        register(m, DOCUMENTATION_FOR_ENTITY, "Get all documentation for an entity",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.HAS_DOCUMENTATION)
                        .includeEntityTypes(EntityType.DOCUMENT));

        // Cross taxonomy; no type restriction
        register(m, SKOS_MATCHES, "Get all SKOS-matched entities (works for risks, capabilities, etc.)",
                TraversalPolicy.builder().maxDepth(1)
                        .includeRelationships(RelationType.SKOS_MATCHES));

        PATTERNS = Collections.unmodifiableMap(m);
    }

    private QueryPatterns() {}

    private static void register(Map<String, QueryPattern> m, String name, String description, TraversalPolicy.Builder policy) {
        m.put(name, new QueryPattern(name, description, policy.build()));
    }

    /**
     * @throws PolicyNotFoundException if no pattern has this name
     */
    public static QueryPattern pattern(String name) {
        QueryPattern p = name == null ? null : PATTERNS.get(name);
        if (p == null) {
            throw new PolicyNotFoundException(name, PATTERNS.keySet());
        }
        return p;
    }

    public static TraversalPolicy policyFor(String name) {
        return pattern(name).policy();
    }

    public static boolean contains(String name) {
        return name != null && PATTERNS.containsKey(name);
    }

    /** Pattern name to description, in catalogue order. */
    public static Map<String, String> describe() {
        Map<String, String> out = new LinkedHashMap<>();
        PATTERNS.forEach((name, p) -> out.put(name, p.description()));
        return Collections.unmodifiableMap(out);
    }

    public static List<String> names() {
        return List.copyOf(PATTERNS.keySet());
    }

    public static Collection<QueryPattern> patterns() {
        return PATTERNS.values();
    }
}
