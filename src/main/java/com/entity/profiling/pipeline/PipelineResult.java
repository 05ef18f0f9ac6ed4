package com.entity.profiling.pipeline;

import com.entity.profiling.report.CoverageReport;

import java.nio.file.Path;

/**
 * Outcome of a completed run.
 *
 * @param runId     identifier used in the run's log context
 * @param report    coverage snapshot, also written to {@code coverage_report.json}
 * @param outputDir directory holding profiles and reports
 */
public record PipelineResult(String runId, CoverageReport report, Path outputDir) {

    public long profilesWritten() {
        return report.profilesWritten();
    }

    public boolean hasFailures() {
        return !report.failedEntities().isEmpty();
    }
}
