package com.e2eq.atlas.core;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class EdgeDerivationTableTest {

    @Test
    void testTypedRulesPrecedeGlobalRules() {
        List<EdgeRule> rules = EdgeDerivationTable.atlasDefaults().rulesFor(EntityType.AI_TASK);

        assertEquals(RelationType.REQUIRES_CAPABILITY, rules.get(0).relation());
        assertEquals(RelationType.HAS_RELATED_LLMINTRINSIC, rules.get(1).relation());
        assertTrue(rules.get(rules.size() - 1).isTypeIndependent());
    }

    @Test
    void testAdaptersAndIntrinsicsShareRelation() {
        EdgeDerivationTable table = EdgeDerivationTable.atlasDefaults();

        EdgeRule adapter = table.rulesFor(EntityType.ADAPTER).get(0);
        EdgeRule intrinsic = table.rulesFor(EntityType.LLM_INTRINSIC).get(0);
        assertEquals("implementsCapability_adapter", adapter.attribute());
        assertEquals("implementsCapability_intrinsic", intrinsic.attribute());
        assertEquals(RelationType.IMPLEMENTS_CAPABILITY, adapter.relation());
        assertEquals(RelationType.IMPLEMENTS_CAPABILITY, intrinsic.relation());
    }

    @Test
    void testDeriveEdgesKeepsOrderAndDropsDangling() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("requiresCapability", List.of("c2", "missing", "c1"));
        attrs.put("hasDocumentation", "doc");
        EntitySnapshot snapshot = EntitySnapshot.builder()
                .add(EntityType.AI_TASK, "t1", attrs)
                .add(EntityRecord.of(EntityType.CAPABILITY, "c1"))
                .add(EntityRecord.of(EntityType.CAPABILITY, "c2"))
                .add(EntityRecord.of(EntityType.DOCUMENT, "doc"))
                .build();
        EntityIndex index = EntityIndex.of(snapshot);
        EntityRecord task = index.lookup(EntityType.AI_TASK, "t1").orElseThrow();

        List<DerivedEdge> edges = EdgeDerivationTable.atlasDefaults().deriveEdges(task, index);

        assertEquals(List.of("c2", "c1", "doc"), edges.stream().map(DerivedEdge::targetId).toList());
        assertEquals(RelationType.HAS_DOCUMENTATION, edges.get(2).relation());
        assertEquals(new NodeKey(EntityType.DOCUMENT, "doc"), edges.get(2).targetKey());
    }

    @Test
    void testBuilderSkipsDuplicatesAndMerges() {
        EdgeDerivationTable extra = EdgeDerivationTable.builder()
                .rule(EntityType.DATASET, "hasLicense", RelationType.HAS_LICENSE, EntityType.LICENSE)
                .globalRule("hasLicense", RelationType.HAS_LICENSE, EntityType.LICENSE)
                .build();
        EdgeDerivationTable merged = EdgeDerivationTable.builder()
                .addAll(EdgeDerivationTable.atlasDefaults())
                .addAll(extra)
                .build();

        assertEquals(EdgeDerivationTable.atlasDefaults().rules().size() + 1, merged.rules().size());
        assertEquals(EdgeRule.global("hasLicense", RelationType.HAS_LICENSE, EntityType.LICENSE),
                merged.rulesFor(EntityType.DATASET).get(merged.rulesFor(EntityType.DATASET).size() - 1));
    }

    @Test
    void testEmptyTableDerivesNothing() {
        EntityRecord task = new EntityRecord(EntityType.AI_TASK, "t1", Map.of("requiresCapability", "c1"));
        EntityIndex index = EntityIndex.of(EntitySnapshot.builder().add(task).add(EntityRecord.of(EntityType.CAPABILITY, "c1")).build());

        assertTrue(EdgeDerivationTable.empty().deriveEdges(task, index).isEmpty());
    }
}
