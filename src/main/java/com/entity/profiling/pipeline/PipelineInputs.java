package com.entity.profiling.pipeline;

import com.entity.profiling.bulk.ImportResult;
import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.HazardRow;

import java.util.List;

/**
 * The raw records of one run, as delivered by the fetch collaborators.
 *
 * @param awards              raw award records, possibly with duplicates
 * @param hazardRows          raw county hazard rows
 * @param malformedAwards     award rows already rejected by an importer
 * @param malformedHazardRows hazard rows already rejected by an importer
 */
public record PipelineInputs(
        List<AwardRecord> awards,
        List<HazardRow> hazardRows,
        long malformedAwards,
        long malformedHazardRows
) {
    public PipelineInputs {
        awards = awards != null ? List.copyOf(awards) : List.of();
        hazardRows = hazardRows != null ? List.copyOf(hazardRows) : List.of();
    }

    public static PipelineInputs of(List<AwardRecord> awards, List<HazardRow> hazardRows) {
        return new PipelineInputs(awards, hazardRows, 0, 0);
    }

    public static PipelineInputs fromImports(ImportResult<AwardRecord> awards, ImportResult<HazardRow> hazards) {
        return new PipelineInputs(awards.records(), hazards.records(), awards.errorCount(), hazards.errorCount());
    }
}
