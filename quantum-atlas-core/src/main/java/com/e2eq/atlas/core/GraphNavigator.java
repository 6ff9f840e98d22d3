package com.e2eq.atlas.core;

import io.quarkus.logging.Log;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Breadth-first traversal engine over a read-only entity graph.
 * <p>
 * A query starts at one entity and walks outgoing edges produced by the
 * {@link EdgeDerivationTable}, level by level, under a {@link TraversalPolicy}:
 * </p>
 * <ol>
 *   <li>A cached result for the same start and policy is returned as is.</li>
 *   <li>An unknown start entity yields {@link TraversalResult#empty()}.</li>
 *   <li>Each dequeued node is reported when its type and attributes pass the policy; the start
 *       node is tested like any other node.</li>
 *   <li>Nodes at {@code maxDepth} are not expanded. Otherwise every allowed edge to a target not
 *       yet visited (or every allowed edge, without deduplication) is recorded and its target
 *       enqueued one level deeper.</li>
 *   <li>The loop ends when the queue drains or the result cap is reached.</li>
 * </ol>
 * <p>
 * Node identity and the visited set use {@link NodeKey}, so entities of different types sharing
 * an id never shadow each other.
 * </p>
 * <p>
 * The entity graph is never mutated. The result cache belongs to this instance and is a
 * concurrent map, so one navigator may serve traversals from several threads.
 * </p>
 */
public class GraphNavigator {

    private final EntityIndex index;
    private final EdgeDerivationTable edgeTable;
    private final ConcurrentMap<TraversalCacheKey, TraversalResult> cache = new ConcurrentHashMap<>();

    public GraphNavigator(EntityIndex index, EdgeDerivationTable edgeTable) {
        this.index = Objects.requireNonNull(index, "index");
        this.edgeTable = Objects.requireNonNull(edgeTable, "edgeTable");
    }

    /**
     * Navigator over the snapshot using the atlas edge rules.
     */
    public GraphNavigator(EntitySnapshot snapshot) {
        this(EntityIndex.of(snapshot), EdgeDerivationTable.atlasDefaults());
    }

    public TraversalResult traverse(String startId, EntityType startType, TraversalPolicy policy) {
        Objects.requireNonNull(policy, "policy");

        TraversalCacheKey cacheKey = null;
        if (policy.cacheEnabled()) {
            cacheKey = policy.cacheKey(startId, startType);
            TraversalResult cached = cache.get(cacheKey);
            if (cached != null) {
                Log.debugf("Traversal cache hit for %s:%s", label(startType), startId);
                return cached;
            }
        }

        Optional<EntityRecord> start = index.lookup(startType, startId);
        if (start.isEmpty()) {
            Log.debugf("Traversal start %s:%s not found; returning empty result", label(startType), startId);
            return TraversalResult.empty();
        }

        TraversalResult result = run(start.get(), policy);

        if (cacheKey != null) {
            TraversalResult existing = cache.putIfAbsent(cacheKey, result);
            if (existing != null) {
                return existing;
            }
        }
        return result;
    }

    public TraversalResult traverse(NodeKey start, TraversalPolicy policy) {
        return traverse(start.id(), start.type(), policy);
    }

    private TraversalResult run(EntityRecord startEntity, TraversalPolicy policy) {
        Set<NodeKey> visited = new HashSet<>();
        List<TraversalNode> nodes = new ArrayList<>();
        Map<NodeKey, List<TraversalEdge>> relationships = new LinkedHashMap<>();
        TreeMap<Integer, List<NodeKey>> depthMap = new TreeMap<>();
        Deque<TraversalNode> queue = new ArrayDeque<>();

        TraversalNode startNode = TraversalNode.start(startEntity);
        queue.add(startNode);
        visited.add(startNode.key());

        int cap = policy.maxResults().orElse(Integer.MAX_VALUE);
        int edgeCount = 0;

        while (!queue.isEmpty() && nodes.size() < cap) {
            TraversalNode current = queue.poll();

            if (policy.allowsEntityType(current.type()) && policy.matchesNodeFilters(current.entity())) {
                nodes.add(current);
                depthMap.computeIfAbsent(current.depth(), k -> new ArrayList<>()).add(current.key());
            }

            if (current.depth() >= policy.maxDepth()) {
                continue;
            }

            for (DerivedEdge edge : edgeTable.deriveEdges(current.entity(), index)) {
                if (!policy.allowsRelationship(edge.relation())) {
                    continue;
                }
                NodeKey target = edge.targetKey();
                if (policy.deduplicateResults() && visited.contains(target)) {
                    continue;
                }
                visited.add(target);

                relationships.computeIfAbsent(current.key(), k -> new ArrayList<>())
                        .add(new TraversalEdge(edge.relation(), edge.targetId(), edge.targetType()));
                edgeCount++;

                List<RelationType> path = new ArrayList<>(current.path().size() + 1);
                path.addAll(current.path());
                path.add(edge.relation());
                queue.add(new TraversalNode(edge.targetId(), edge.targetType(), edge.target(),
                        current.depth() + 1, path, current.key()));
            }
        }

        int maxDepthReached = depthMap.isEmpty() ? 0 : depthMap.lastKey();
        TraversalStatistics stats = new TraversalStatistics(visited.size(), nodes.size(), maxDepthReached, edgeCount);

        Log.debugf("Traversal from %s finished: %d returned, %d visited, %d edges, max depth %d",
                startEntity, stats.nodesReturned(), stats.nodesVisited(), stats.relationshipsTraversed(), stats.maxDepthReached());
        return new TraversalResult(nodes, relationships, depthMap, stats);
    }

    /** Drops every cached result. Later queries recompute. */
    public void clearCache() {
        cache.clear();
    }

    public int cachedResultCount() {
        return cache.size();
    }

    public EntityIndex index() {
        return index;
    }

    public EdgeDerivationTable edgeTable() {
        return edgeTable;
    }

    private static String label(EntityType type) {
        return type == null ? "null" : type.label();
    }
}
