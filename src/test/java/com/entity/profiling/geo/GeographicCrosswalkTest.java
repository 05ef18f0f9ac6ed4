package com.entity.profiling.geo;

import com.entity.profiling.core.model.CrosswalkEntry;
import com.entity.profiling.core.model.CrosswalkMethod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GeographicCrosswalkTest {

    private static CrosswalkEntry area(String entityId, String county, double weight) {
        return new CrosswalkEntry(entityId, county, weight, CrosswalkMethod.AREA_WEIGHTED, 1.0);
    }

    @Test
    void groupsEntriesByEntity() {
        GeographicCrosswalk crosswalk = GeographicCrosswalk.of(List.of(
                area("E2", "04001", 1.0),
                area("E1", "04001", 0.6),
                area("E1", "04003", 0.4),
                CrosswalkEntry.fallback("E3", "35")));

        assertEquals(Set.of("E1", "E2", "E3"), crosswalk.entityIds());
        assertEquals(2, crosswalk.entriesFor("E1").size());
        assertEquals(4, crosswalk.linkCount());
        assertEquals(1, crosswalk.fallbackCount());
        assertEquals("E1", crosswalk.entries().get(0).entityId());
        assertTrue(crosswalk.entriesFor("missing").isEmpty());
    }

    @Test
    void rejectsWeightsThatDoNotSumToOne() {
        assertThrows(IllegalArgumentException.class, () -> GeographicCrosswalk.of(List.of(
                area("E1", "04001", 0.6), area("E1", "04003", 0.3))));
    }

    @Test
    void acceptsSumsWithinTolerance() {
        assertDoesNotThrow(() -> GeographicCrosswalk.of(List.of(
                area("E1", "04001", 0.6), area("E1", "04003", 0.4000001)), 1e-6));
    }

    @Test
    void rejectsFallbackMixedWithAreaEntries() {
        assertThrows(IllegalArgumentException.class, () -> GeographicCrosswalk.of(List.of(
                CrosswalkEntry.fallback("E1", "04"), area("E1", "04001", 1.0))));
    }

    @Test
    void rejectsDuplicateCounties() {
        assertThrows(IllegalArgumentException.class, () -> GeographicCrosswalk.of(List.of(
                area("E1", "04001", 0.5), area("E1", "04001", 0.5))));
    }

    @Test
    void emptyCrosswalk() {
        assertEquals(0, GeographicCrosswalk.empty().entityCount());
    }
}
