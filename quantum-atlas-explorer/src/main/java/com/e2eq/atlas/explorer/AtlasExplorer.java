package com.e2eq.atlas.explorer;

import com.e2eq.atlas.core.*;
import com.e2eq.atlas.patterns.QueryPatterns;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Question oriented entry point over a {@link GraphNavigator}.
 * <p>
 * The convenience queries resolve their start entity with an {@link EntityMatch}, run one of the
 * {@link QueryPatterns}, keep the entities of the expected type and finally apply the optional
 * taxonomy filter. A start entity that cannot be found yields an empty list.
 * </p>
 * Entity types are always passed explicitly; they are never guessed from an id.
 */
@ApplicationScoped
public class AtlasExplorer {

    private final GraphNavigator navigator;

    @Inject
    public AtlasExplorer(GraphNavigator navigator) {
        this.navigator = Objects.requireNonNull(navigator, "navigator");
    }

    public GraphNavigator navigator() {
        return navigator;
    }

    // ---- generic navigation ----

    /**
     * @throws com.e2eq.atlas.exceptions.PolicyNotFoundException for an unknown pattern name
     */
    public TraversalResult navigate(String startId, EntityType startType, String patternName) {
        return navigator.traverse(startId, startType, QueryPatterns.policyFor(patternName));
    }

    public TraversalResult navigate(String startId, EntityType startType, TraversalPolicy policy) {
        return navigator.traverse(startId, startType, policy);
    }

    /**
     * Entities reached from {@code entity} over one relation, excluding the start itself.
     *
     * @param targetType optional type restriction, {@code null} for any
     * @param taxonomy   optional {@code isDefinedByTaxonomy} value, {@code null} for any
     */
    public List<EntityRecord> related(EntityRecord entity, RelationType relation, EntityType targetType,
                                      int maxDepth, String taxonomy) {
        return related(entity.id(), entity.type(), relation, targetType, maxDepth, taxonomy);
    }

    public List<EntityRecord> related(String id, EntityType type, RelationType relation, EntityType targetType,
                                      int maxDepth, String taxonomy) {
        TraversalPolicy.Builder b = TraversalPolicy.builder()
                .maxDepth(maxDepth)
                .includeRelationships(relation);
        if (targetType != null) {
            b.includeEntityTypes(targetType);
        }
        if (taxonomy != null) {
            b.nodePropertyFilter(EntityRecord.ATTR_TAXONOMY, taxonomy);
        }
        return navigator.traverse(id, type, b.build()).nodes().stream()
                .filter(n -> n.depth() > 0)
                .map(TraversalNode::entity)
                .collect(Collectors.toList());
    }

    public List<EntityRecord> related(EntityRecord entity, RelationType relation, EntityType targetType) {
        return related(entity, relation, targetType, 1, null);
    }

    // ---- lookups ----

    public List<EntityRecord> allEntities(EntityType type, String taxonomy) {
        return filterTaxonomy(navigator.index().entities(type), taxonomy);
    }

    public List<EntityRecord> allEntities(EntityType type) {
        return allEntities(type, null);
    }

    public Optional<EntityRecord> findEntity(EntityType type, EntityMatch match) {
        if (match == null || match.isEmpty()) {
            return Optional.empty();
        }
        if (match.id() != null && !match.id().isEmpty()) {
            return navigator.index().lookup(type, match.id()).filter(match::matches);
        }
        return navigator.index().entities(type).stream().filter(match::matches).findFirst();
    }

    // ---- capabilities and tasks ----

    public List<EntityRecord> capabilitiesForTask(EntityMatch task, String taxonomy) {
        return query(EntityType.AI_TASK, task, QueryPatterns.CAPABILITIES_FOR_TASK,
                EnumSet.of(EntityType.CAPABILITY), taxonomy, false);
    }

    /**
     * Intrinsics, and unless {@code includeAdapters} is false adapters, implementing a capability.
     */
    public List<EntityRecord> intrinsicsForCapability(EntityMatch capability, String taxonomy, boolean includeAdapters) {
        Set<EntityType> wanted = includeAdapters
                ? EnumSet.of(EntityType.LLM_INTRINSIC, EntityType.ADAPTER)
                : EnumSet.of(EntityType.LLM_INTRINSIC);
        return query(EntityType.CAPABILITY, capability, QueryPatterns.INTRINSICS_FOR_CAPABILITY, wanted, taxonomy, false);
    }

    public List<EntityRecord> intrinsicsForCapability(EntityMatch capability) {
        return intrinsicsForCapability(capability, null, true);
    }

    public List<EntityRecord> tasksForCapability(EntityMatch capability, String taxonomy) {
        return query(EntityType.CAPABILITY, capability, QueryPatterns.TASKS_FOR_CAPABILITY,
                EnumSet.of(EntityType.AI_TASK), taxonomy, false);
    }

    public List<EntityRecord> intrinsicsForTask(EntityMatch task, String taxonomy) {
        return query(EntityType.AI_TASK, task, QueryPatterns.INTRINSICS_FOR_TASK,
                EnumSet.of(EntityType.LLM_INTRINSIC), taxonomy, false);
    }

    // ---- risks ----

    public List<EntityRecord> relatedRisks(EntityMatch risk, String taxonomy) {
        return query(EntityType.RISK, risk, QueryPatterns.RELATED_RISKS,
                EnumSet.of(EntityType.RISK), taxonomy, true);
    }

    public List<EntityRecord> controlsForRisk(EntityMatch risk, String taxonomy) {
        return query(EntityType.RISK, risk, QueryPatterns.CONTROLS_FOR_RISK,
                EnumSet.of(EntityType.RISK_CONTROL), taxonomy, false);
    }

    public List<EntityRecord> actionsForRisk(EntityMatch risk, String taxonomy) {
        return query(EntityType.RISK, risk, QueryPatterns.ACTIONS_FOR_RISK,
                EnumSet.of(EntityType.ACTION), taxonomy, false);
    }

    // ---- end to end ----

    /**
     * Follows a task to its capabilities and on to the intrinsics and adapters implementing them.
     * Intrinsics are grouped under the capability they were discovered from.
     */
    public Optional<TaskIntrinsicTrace> traceTaskToIntrinsics(EntityMatch task) {
        Optional<EntityRecord> start = findEntity(EntityType.AI_TASK, task);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        TraversalResult result = navigate(start.get().id(), EntityType.AI_TASK, QueryPatterns.END_TO_END_TASK_TO_INTRINSICS);

        List<EntityRecord> capabilities = new ArrayList<>();
        Map<String, List<EntityRecord>> byCapability = new LinkedHashMap<>();
        for (TraversalNode node : result.nodes()) {
            if (node.type() == EntityType.CAPABILITY && node.depth() == 1) {
                capabilities.add(node.entity());
                byCapability.put(node.id(), new ArrayList<>());
            }
        }

        List<EntityRecord> all = new ArrayList<>();
        for (TraversalNode node : result.nodes()) {
            boolean implementation = node.type() == EntityType.LLM_INTRINSIC || node.type() == EntityType.ADAPTER;
            if (!implementation || node.depth() != 2 || node.parent() == null) {
                continue;
            }
            if (node.parent().type() == EntityType.CAPABILITY) {
                List<EntityRecord> group = byCapability.get(node.parent().id());
                if (group != null) {
                    group.add(node.entity());
                }
            }
            all.add(node.entity());
        }
        return Optional.of(new TaskIntrinsicTrace(start.get(), capabilities, byCapability, all));
    }

    private List<EntityRecord> query(EntityType startType, EntityMatch match, String pattern,
                                     Set<EntityType> wanted, String taxonomy, boolean excludeStart) {
        Optional<EntityRecord> start = findEntity(startType, match);
        if (start.isEmpty()) {
            Log.debugf("No %s matching %s; %s yields nothing", startType.label(), match, pattern);
            return List.of();
        }
        List<EntityRecord> found = navigate(start.get().id(), startType, pattern).nodes().stream()
                .filter(n -> wanted.contains(n.type()))
                .filter(n -> !excludeStart || n.depth() > 0)
                .map(TraversalNode::entity)
                .collect(Collectors.toList());
        return filterTaxonomy(found, taxonomy);
    }

    private static List<EntityRecord> filterTaxonomy(List<EntityRecord> entities, String taxonomy) {
        if (taxonomy == null) {
            return entities;
        }
        return entities.stream()
                .filter(e -> e.taxonomy().map(taxonomy::equals).orElse(false))
                .collect(Collectors.toList());
    }
}
