package com.e2eq.atlas.explorer;

import com.e2eq.atlas.core.EntityRecord;
import com.e2eq.atlas.core.EntityType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class EntityMatchTest {

    private final EntityRecord risk = new EntityRecord(EntityType.RISK, "r1",
            Map.of("name", "Toxic output", "tag", "toxic", "isDefinedByTaxonomy", "ibm-risk-atlas"));

    @Test
    void testSingleCriteria() {
        assertTrue(EntityMatch.byId("r1").matches(risk));
        assertTrue(EntityMatch.byTag("toxic").matches(risk));
        assertTrue(EntityMatch.byName("Toxic output").matches(risk));
        assertTrue(EntityMatch.of(risk).matches(risk));
        assertFalse(EntityMatch.byId("r2").matches(risk));
    }

    @Test
    void testCriteriaAreCombined() {
        assertTrue(EntityMatch.byTag("toxic").withTaxonomy("ibm-risk-atlas").matches(risk));
        assertFalse(EntityMatch.byTag("toxic").withTaxonomy("nist-ai-rmf").matches(risk));
        assertFalse(new EntityMatch("r1", "other", null, null).matches(risk));
    }

    @Test
    void testEmptyMatchesNothing() {
        EntityMatch none = new EntityMatch(null, "", null, null);
        assertTrue(none.isEmpty());
        assertFalse(none.matches(risk));
        assertFalse(EntityMatch.byId("r1").matches(null));
        assertFalse(EntityMatch.byTag("toxic").matches(EntityRecord.of(EntityType.RISK, "untagged")));
    }
}
