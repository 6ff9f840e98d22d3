package com.e2eq.atlas.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphNavigatorTest {

    private GraphNavigator navigator;

    @BeforeEach
    void setUp() {
        EntitySnapshot snapshot = EntitySnapshot.builder()
                .add(EntityType.AI_TASK, "t1", attrs("requiresCapability", List.of("c1", "c2")))
                .add(EntityType.AI_TASK, "t2", attrs("requiresCapability", List.of("c1", "c-missing")))
                .add(EntityType.CAPABILITY, "c1", attrs(
                        "isDefinedByTaxonomy", "tax-a",
                        "tag", "reading",
                        "implementedByIntrinsic", List.of("i1"),
                        "exactMatch", List.of("c2")))
                .add(EntityType.CAPABILITY, "c2", attrs(
                        "isDefinedByTaxonomy", "tax-b",
                        "tag", "reading",
                        "exactMatch", List.of("c1")))
                .add(EntityType.LLM_INTRINSIC, "i1", attrs("isDefinedByTaxonomy", "tax-a"))
                .build();
        navigator = new GraphNavigator(snapshot);
    }

    private static Map<String, Object> attrs(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    private static TraversalPolicy requiresOnly(int depth) {
        return TraversalPolicy.builder()
                .maxDepth(depth)
                .includeRelationships(RelationType.REQUIRES_CAPABILITY)
                .includeEntityTypes(EntityType.CAPABILITY)
                .build();
    }

    @Test
    void testTaskToCapabilities() {
        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, requiresOnly(1));

        assertEquals(List.of("c1", "c2"), result.nodes().stream().map(TraversalNode::id).toList());
        assertTrue(result.nodes().stream().allMatch(n -> n.depth() == 1 && n.type() == EntityType.CAPABILITY));
        assertTrue(result.nodesAtDepth(2).isEmpty());
        assertEquals(2, result.statistics().relationshipsTraversed());
        assertEquals(2, result.statistics().nodesReturned());
        assertEquals(3, result.statistics().nodesVisited());
        assertEquals(1, result.statistics().maxDepthReached());

        TraversalNode c1 = result.node(EntityType.CAPABILITY, "c1").orElseThrow();
        assertEquals(List.of(RelationType.REQUIRES_CAPABILITY), c1.path());
        assertEquals(new NodeKey(EntityType.AI_TASK, "t1"), c1.parent());
        assertEquals(2, result.relationshipsFrom(EntityType.AI_TASK, "t1").size());
    }

    @Test
    void testDanglingReferenceIsDropped() {
        TraversalResult result = navigator.traverse("t2", EntityType.AI_TASK, requiresOnly(1));

        assertEquals(1, result.nodes().size());
        assertEquals("c1", result.nodes().get(0).id());
        assertEquals(1, result.statistics().relationshipsTraversed());
    }

    @Test
    void testZeroDepthReturnsOnlyStart() {
        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK,
                TraversalPolicy.builder().maxDepth(0).build());

        assertEquals(1, result.nodes().size());
        assertTrue(result.nodes().get(0).isStart());
        assertTrue(result.relationships().isEmpty());
        assertEquals(0, result.statistics().relationshipsTraversed());
    }

    @Test
    void testZeroDepthStartFilteredOut() {
        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK,
                TraversalPolicy.builder().maxDepth(0).includeEntityTypes(EntityType.CAPABILITY).build());

        assertTrue(result.isEmpty());
        assertEquals(1, result.statistics().nodesVisited());
    }

    @Test
    void testDepthBoundAndLevelOrder() {
        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, TraversalPolicy.builder().maxDepth(2).build());

        int previous = 0;
        for (TraversalNode node : result.nodes()) {
            assertTrue(node.depth() <= 2, "depth bound violated by " + node);
            assertTrue(node.depth() >= previous, "nodes must be in level order");
            previous = node.depth();
            if (node.depth() > 0) {
                TraversalNode parent = result.node(node.parent().type(), node.parent().id()).orElseThrow();
                assertEquals(node.depth() - 1, parent.depth());
                assertEquals(node.path().size(), node.depth());
            }
        }
        // t1 -> c1, c2 -> i1; the exactMatch edges lead back to already visited capabilities
        assertTrue(result.node(EntityType.LLM_INTRINSIC, "i1").isPresent());
        assertEquals(2, result.statistics().maxDepthReached());
    }

    @Test
    void testExclusionWinsOverInclusion() {
        TraversalPolicy policy = TraversalPolicy.builder()
                .maxDepth(2)
                .includeRelationships(RelationType.REQUIRES_CAPABILITY)
                .excludeRelationships(RelationType.REQUIRES_CAPABILITY)
                .build();

        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, policy);

        assertEquals(1, result.nodes().size());
        assertTrue(result.relationships().isEmpty());
    }

    @Test
    void testPropertyFiltersAreConjunctive() {
        TraversalPolicy both = TraversalPolicy.builder()
                .maxDepth(1)
                .nodePropertyFilter("isDefinedByTaxonomy", "tax-a")
                .nodePropertyFilter("tag", "reading")
                .build();
        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, both);
        assertEquals(List.of("c1"), result.nodes().stream().map(TraversalNode::id).toList());

        TraversalPolicy oneUnmet = both.toBuilder().nodePropertyFilter("tag", "writing").build();
        assertTrue(navigator.traverse("t1", EntityType.AI_TASK, oneUnmet).isEmpty());
    }

    @Test
    void testFilteredNodesAreStillExpanded() {
        // start and capabilities are filtered out, the intrinsic behind them is still reached
        TraversalPolicy policy = TraversalPolicy.builder()
                .maxDepth(2)
                .includeEntityTypes(EntityType.LLM_INTRINSIC)
                .build();

        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, policy);

        assertEquals(1, result.nodes().size());
        assertEquals("i1", result.nodes().get(0).id());
        assertEquals(2, result.nodes().get(0).depth());
    }

    @Test
    void testMaxResultsCapsReportedNodes() {
        TraversalPolicy policy = TraversalPolicy.builder().maxDepth(2).maxResults(2).build();

        TraversalResult result = navigator.traverse("t1", EntityType.AI_TASK, policy);

        assertEquals(2, result.nodes().size());
        assertEquals(2, result.statistics().nodesReturned());
    }

    @Test
    void testUnknownStartYieldsEmptyUncachedResult() {
        TraversalResult result = navigator.traverse("nope", EntityType.AI_TASK, TraversalPolicy.defaults());

        assertTrue(result.isEmpty());
        assertEquals(TraversalStatistics.EMPTY, result.statistics());
        assertEquals(0, navigator.cachedResultCount());

        // id exists, but under another type
        assertTrue(navigator.traverse("c1", EntityType.AI_TASK, TraversalPolicy.defaults()).isEmpty());
    }

    @Test
    void testCachingIsIdempotent() {
        TraversalPolicy policy = requiresOnly(1);

        TraversalResult first = navigator.traverse("t1", EntityType.AI_TASK, policy);
        TraversalResult second = navigator.traverse("t1", EntityType.AI_TASK, policy);
        assertSame(first, second);
        assertEquals(1, navigator.cachedResultCount());

        navigator.clearCache();
        assertEquals(0, navigator.cachedResultCount());

        TraversalResult recomputed = navigator.traverse("t1", EntityType.AI_TASK, policy);
        assertNotSame(first, recomputed);
        assertEquals(first, recomputed);
    }

    @Test
    void testCacheDisabledDoesNotStore() {
        TraversalPolicy policy = requiresOnly(1).toBuilder().cacheEnabled(false).build();

        TraversalResult first = navigator.traverse("t1", EntityType.AI_TASK, policy);
        TraversalResult second = navigator.traverse("t1", EntityType.AI_TASK, policy);

        assertEquals(first, second);
        assertEquals(0, navigator.cachedResultCount());
    }

    @Test
    void testCapIsPartOfCacheIdentity() {
        TraversalPolicy uncapped = TraversalPolicy.builder().maxDepth(2).build();
        TraversalPolicy capped = uncapped.toBuilder().maxResults(1).build();

        TraversalResult full = navigator.traverse("t1", EntityType.AI_TASK, uncapped);
        TraversalResult one = navigator.traverse("t1", EntityType.AI_TASK, capped);

        assertTrue(full.nodes().size() > 1);
        assertEquals(1, one.nodes().size());
        assertEquals(2, navigator.cachedResultCount());
    }

    @Test
    void testFilterValuesOfDifferentTypesAreCachedSeparately() {
        EntitySnapshot snapshot = EntitySnapshot.builder()
                .add(EntityType.CAPABILITY, "c1", attrs("level", 3))
                .build();
        GraphNavigator nav = new GraphNavigator(snapshot);
        TraversalPolicy longFilter = TraversalPolicy.builder().nodePropertyFilter("level", 3L).build();
        TraversalPolicy intFilter = TraversalPolicy.builder().nodePropertyFilter("level", 3).build();

        assertTrue(nav.traverse("c1", EntityType.CAPABILITY, longFilter).isEmpty());
        TraversalResult matched = nav.traverse("c1", EntityType.CAPABILITY, intFilter);

        assertEquals(1, matched.nodes().size());
        assertEquals(2, nav.cachedResultCount());
    }

    @Test
    void testConcurrentIdenticalTraversalsShareOneResult() throws Exception {
        TraversalPolicy policy = TraversalPolicy.builder().maxDepth(2).build();
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TraversalResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return navigator.traverse("t1", EntityType.AI_TASK, policy);
                }));
            }
            start.countDown();

            List<TraversalResult> results = new ArrayList<>();
            for (Future<TraversalResult> f : futures) {
                results.add(f.get(10, TimeUnit.SECONDS));
            }

            TraversalResult stored = navigator.traverse("t1", EntityType.AI_TASK, policy);
            for (TraversalResult r : results) {
                assertSame(stored, r);
            }
            assertEquals(1, navigator.cachedResultCount());
        } finally {
            executor.shutdownNow();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    void testSameIdDifferentTypesAreDistinct() {
        EntitySnapshot snapshot = EntitySnapshot.builder()
                .add(EntityType.AI_TASK, "shared", attrs("requiresCapability", List.of("shared")))
                .add(EntityType.CAPABILITY, "shared", attrs())
                .build();
        GraphNavigator nav = new GraphNavigator(snapshot);

        TraversalResult result = nav.traverse("shared", EntityType.AI_TASK, TraversalPolicy.defaults());

        assertEquals(2, result.nodes().size());
        assertTrue(result.node(EntityType.AI_TASK, "shared").isPresent());
        assertTrue(result.node(EntityType.CAPABILITY, "shared").isPresent());
        assertEquals(2, result.statistics().nodesVisited());
    }

    @Test
    void testWithoutDeduplicationCyclesRepeatUpToDepth() {
        TraversalPolicy skos = TraversalPolicy.builder()
                .maxDepth(3)
                .includeRelationships(RelationType.EXACT_MATCH)
                .build();

        TraversalResult deduped = navigator.traverse("c1", EntityType.CAPABILITY, skos);
        assertEquals(List.of("c1", "c2"), deduped.nodes().stream().map(TraversalNode::id).toList());
        assertEquals(1, deduped.statistics().relationshipsTraversed());

        TraversalResult repeated = navigator.traverse("c1", EntityType.CAPABILITY,
                skos.toBuilder().deduplicateResults(false).build());
        assertEquals(List.of("c1", "c2", "c1", "c2"), repeated.nodes().stream().map(TraversalNode::id).toList());
        assertEquals(List.of(0, 1, 2, 3), repeated.nodes().stream().map(TraversalNode::depth).toList());
        assertEquals(3, repeated.statistics().relationshipsTraversed());
    }

    @Test
    void testCustomEdgeTable() {
        EntitySnapshot snapshot = EntitySnapshot.builder()
                .add(EntityType.DATASET, "d1", attrs("hasLicense", "apache-2"))
                .add(EntityType.LICENSE, "apache-2", attrs())
                .build();
        GraphNavigator nav = new GraphNavigator(EntityIndex.of(snapshot), EdgeDerivationTable.empty());
        assertEquals(1, nav.traverse("d1", EntityType.DATASET, TraversalPolicy.defaults()).nodes().size());

        GraphNavigator withDefaults = new GraphNavigator(snapshot);
        TraversalResult result = withDefaults.traverse("d1", EntityType.DATASET, TraversalPolicy.defaults());
        assertEquals(2, result.nodes().size());
        assertEquals(RelationType.HAS_LICENSE, result.relationshipsFrom(EntityType.DATASET, "d1").get(0).relation());
    }
}
