package com.entity.profiling.profile;

import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.model.AggregationMethod;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.Confidence;
import com.entity.profiling.core.model.CoverageMetadata;
import com.entity.profiling.core.model.DataCoverage;
import com.entity.profiling.core.model.EntityProfile;
import com.entity.profiling.core.model.FundingTrend;
import com.entity.profiling.core.model.GeographySource;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.core.model.MetricAggregate;
import com.entity.profiling.core.model.MetricCoverage;
import com.entity.profiling.core.model.ProgramTotal;
import com.entity.profiling.core.model.RankedHazard;
import com.entity.profiling.metrics.MetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProfileWriterTest {

    @TempDir
    Path dir;

    private static EntityProfile profile(String entityId) {
        HazardSummary hazard = new HazardSummary(Confidence.HIGH, 2,
                List.of(new RankedHazard("HRCN", "Hurricane", 59.0, "Relatively Moderate",
                        AggregationMethod.WEIGHTED_MEAN, 50.0, null, null)),
                Map.of("HRCN_RISKS", new MetricAggregate(59.0, AggregationMethod.WEIGHTED_MEAN,
                        MetricCoverage.FULL, 2, 1.0)));
        AwardSummary award = new AwardSummary(new BigDecimal("1250000.00"),
                Map.of("P1", new ProgramTotal(1, new BigDecimal("1250000.00"))), 1, List.of("R1"),
                Map.of(2024, new BigDecimal("1250000.00")), FundingTrend.NEW);
        CoverageMetadata coverage = new CoverageMetadata(GeographySource.AREA_WEIGHTED, Confidence.HIGH,
                DataCoverage.REAL, DataCoverage.REAL, 1, List.of(), List.of("HRCN_EALT"), List.of());
        return new EntityProfile(entityId, "Test Nation of ABC", hazard, award, coverage);
    }

    @Test
    void writesOneSnakeCaseJsonFilePerEntity() throws IOException {
        MetricsService metrics = mock(MetricsService.class);
        ProfileWriter writer = new ProfileWriter(dir.resolve("profiles"), JsonSupport.mapper(), metrics);

        Path file = writer.write(profile("E1"));

        assertEquals(dir.resolve("profiles/E1.json"), file);
        JsonNode json = JsonSupport.mapper().readTree(file.toFile());
        assertEquals("E1", json.get("entity_id").asText());
        assertEquals("Test Nation of ABC", json.get("display_name").asText());
        assertEquals("HIGH", json.at("/hazard_summary/confidence").asText());
        assertEquals("HRCN", json.at("/hazard_summary/top_hazards/0/code").asText());
        assertEquals(59.0, json.at("/hazard_summary/metrics/HRCN_RISKS/value").asDouble());
        assertTrue(Files.readString(file).contains("\"total_obligation\" : 1250000.00"));
        assertEquals("AREA_WEIGHTED", json.at("/coverage_metadata/geography").asText());
        assertFalse(Files.readString(file).contains("E+"));
        verify(metrics).incrementProfileWritten();
    }

    @Test
    void sameProfileProducesIdenticalBytes() throws IOException {
        ProfileWriter writer = new ProfileWriter(dir);
        Path file = writer.write(profile("E1"));
        byte[] first = Files.readAllBytes(file);

        writer.write(profile("E1"));

        assertArrayEquals(first, Files.readAllBytes(file));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void unsafeEntityIdIsRejected() {
        MetricsService metrics = mock(MetricsService.class);
        ProfileWriter writer = new ProfileWriter(dir, JsonSupport.mapper(), metrics);

        ProfileWriteException e = assertThrows(ProfileWriteException.class, () -> writer.write(profile("../E1")));
        assertEquals("../E1", e.getEntityId());
        assertFalse(Files.exists(dir.getParent().resolve("E1.json")));
        verify(metrics).incrementProfileFailure();
    }

    @Test
    void ioFailureLeavesPreviousProfileIntact() throws IOException {
        Path blocked = dir.resolve("profiles");
        Files.writeString(blocked, "not a directory");
        ProfileWriter writer = new ProfileWriter(blocked);

        assertThrows(ProfileWriteException.class, () -> writer.write(profile("E1")));
        assertEquals("not a directory", Files.readString(blocked));
    }

    @Test
    void fiveArgumentFormWritesTheSameProfile() throws IOException {
        ProfileWriter writer = new ProfileWriter(dir);
        EntityProfile p = profile("E2");
        Path file = writer.write(p.entityId(), p.displayName(), p.hazardSummary(), p.awardSummary(),
                p.coverageMetadata());

        assertEquals(writer.pathFor("E2"), file);
        JsonNode json = JsonSupport.mapper().readTree(file.toFile());
        assertEquals("E2", json.get("entity_id").asText());
        assertEquals("NEW", json.at("/award_summary/trend").asText());
    }
}
