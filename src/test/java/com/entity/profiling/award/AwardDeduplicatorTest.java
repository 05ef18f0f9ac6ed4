package com.entity.profiling.award;

import com.entity.profiling.core.model.AwardRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AwardDeduplicatorTest {

    private final AwardDeduplicator deduplicator = new AwardDeduplicator();

    @Test
    void repeatedRecordIdKeepsFirstOccurrence() {
        AwardRecord first = new AwardRecord("R1", "Hopi Tribe", BigDecimal.TEN, "P1", "2024");
        AwardRecord repeat = new AwardRecord("R1", "HOPI TRIBE, AZ", BigDecimal.ONE, "P1", "2024");
        AwardRecord other = new AwardRecord("R2", "Hopi Tribe", BigDecimal.TEN, "P1", "2024");

        AwardDeduplicator.Result result = deduplicator.deduplicate(List.of(first, repeat, other));

        assertEquals(List.of(first, other), result.records());
        assertEquals(1, result.duplicates());
    }

    @Test
    void blankIdsFallBackToRecordContent() {
        AwardRecord a = new AwardRecord(" ", "Hopi Tribe", new BigDecimal("10.00"), "P1", "2024");
        AwardRecord sameContent = new AwardRecord("", "Hopi Tribe", new BigDecimal("10.00"), "P1", "2024");
        AwardRecord otherYear = new AwardRecord("", "Hopi Tribe", new BigDecimal("10.00"), "P1", "2023");

        AwardDeduplicator.Result result = deduplicator.deduplicate(List.of(a, sameContent, otherYear));

        assertEquals(List.of(a, otherYear), result.records());
        assertEquals(1, result.duplicates());
    }

    @Test
    void emptyInput() {
        AwardDeduplicator.Result result = deduplicator.deduplicate(List.of());
        assertTrue(result.records().isEmpty());
        assertEquals(0, result.duplicates());
    }
}
