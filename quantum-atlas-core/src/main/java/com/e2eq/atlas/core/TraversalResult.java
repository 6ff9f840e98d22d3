package com.e2eq.atlas.core;

import com.e2eq.atlas.dto.TraversalResultPayload;

import java.util.*;

/**
 * Immutable outcome of one traversal.
 *
 * @param nodes         reported nodes in discovery order, depth never decreasing
 * @param relationships edges followed, keyed by their source node, in the order they were followed
 * @param depthMap      keys of the reported nodes per depth
 * @param statistics    summary counters
 */
public record TraversalResult(
        List<TraversalNode> nodes,
        Map<NodeKey, List<TraversalEdge>> relationships,
        Map<Integer, List<NodeKey>> depthMap,
        TraversalStatistics statistics
) {

    private static final TraversalResult EMPTY =
            new TraversalResult(List.of(), Map.of(), Map.of(), TraversalStatistics.EMPTY);

    public TraversalResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);

        Map<NodeKey, List<TraversalEdge>> rels = new LinkedHashMap<>();
        if (relationships != null) {
            relationships.forEach((k, v) -> rels.put(k, List.copyOf(v)));
        }
        relationships = Collections.unmodifiableMap(rels);

        Map<Integer, List<NodeKey>> depths = new TreeMap<>();
        if (depthMap != null) {
            depthMap.forEach((k, v) -> depths.put(k, List.copyOf(v)));
        }
        depthMap = Collections.unmodifiableMap(depths);

        statistics = statistics == null ? TraversalStatistics.EMPTY : statistics;
    }

    /** Result of a traversal whose start entity does not exist. */
    public static TraversalResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public List<TraversalNode> nodesAtDepth(int depth) {
        List<NodeKey> keys = depthMap.getOrDefault(depth, List.of());
        if (keys.isEmpty()) {
            return List.of();
        }
        Set<NodeKey> wanted = new HashSet<>(keys);
        return nodes.stream().filter(n -> n.depth() == depth && wanted.contains(n.key())).toList();
    }

    public List<TraversalNode> nodesOfType(EntityType type) {
        return nodes.stream().filter(n -> n.type() == type).toList();
    }

    /** Entity records of the reported nodes of one type, in discovery order. */
    public List<EntityRecord> entitiesOfType(EntityType type) {
        return nodes.stream().filter(n -> n.type() == type).map(TraversalNode::entity).toList();
    }

    /**
     * First reported node with the given id, whatever its type.
     */
    public Optional<TraversalNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Optional<TraversalNode> node(EntityType type, String id) {
        return nodes.stream().filter(n -> n.type() == type && n.id().equals(id)).findFirst();
    }

    public List<TraversalEdge> relationshipsFrom(NodeKey source) {
        return relationships.getOrDefault(source, List.of());
    }

    public List<TraversalEdge> relationshipsFrom(EntityType type, String id) {
        return relationshipsFrom(new NodeKey(type, id));
    }

    public TraversalResultPayload toPayload() {
        List<TraversalResultPayload.Node> payloadNodes = new ArrayList<>(nodes.size());
        for (TraversalNode n : nodes) {
            payloadNodes.add(new TraversalResultPayload.Node(
                    n.id(),
                    n.type().label(),
                    n.depth(),
                    n.path().stream().map(RelationType::label).toList(),
                    n.parentId(),
                    n.parent() == null ? null : n.parent().type().label()));
        }

        List<TraversalResultPayload.Edge> payloadEdges = new ArrayList<>();
        relationships.forEach((source, edges) -> {
            for (TraversalEdge e : edges) {
                payloadEdges.add(new TraversalResultPayload.Edge(
                        source.id(), source.type().label(), e.relation().label(), e.targetId(), e.targetType().label()));
            }
        });

        Map<Integer, List<String>> payloadDepths = new TreeMap<>();
        depthMap.forEach((depth, keys) -> payloadDepths.put(depth, keys.stream().map(NodeKey::id).toList()));

        return new TraversalResultPayload(payloadNodes, payloadEdges, payloadDepths, statistics.toMap());
    }
}
