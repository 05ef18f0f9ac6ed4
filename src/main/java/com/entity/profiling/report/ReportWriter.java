package com.entity.profiling.report;

import com.entity.profiling.core.AtomicFiles;
import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.model.MatchCandidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the run-level reports next to the profiles directory:
 * {@code coverage_report.json}, {@code coverage_report.md} and
 * {@code unattributed_records.json}.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String COVERAGE_JSON = "coverage_report.json";
    public static final String COVERAGE_MARKDOWN = "coverage_report.md";
    public static final String UNATTRIBUTED_JSON = "unattributed_records.json";

    private final Path outputDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ReportWriter(Path outputDir) {
        this(outputDir, JsonSupport.mapper(), Clock.systemUTC());
    }

    public ReportWriter(Path outputDir, ObjectMapper mapper, Clock clock) {
        this.outputDir = outputDir;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Writes all three reports.
     *
     * @throws UncheckedIOException if a report cannot be written
     */
    public void write(CoverageReport report, List<UnattributedRecord> unattributed) {
        String generatedAt = Instant.now(clock).toString();
        try {
            ObjectNode coverage = mapper.createObjectNode();
            coverage.put("generated_at", generatedAt);
            coverage.set("report", mapper.valueToTree(report));
            AtomicFiles.write(outputDir.resolve(COVERAGE_JSON), mapper.writeValueAsBytes(coverage));

            AtomicFiles.write(outputDir.resolve(COVERAGE_MARKDOWN),
                    toMarkdown(report, unattributed, generatedAt).getBytes(StandardCharsets.UTF_8));

            ObjectNode records = mapper.createObjectNode();
            records.put("generated_at", generatedAt);
            records.put("count", unattributed.size());
            records.put("total_amount", report.unattributedAmount());
            records.set("records", mapper.valueToTree(unattributed));
            AtomicFiles.write(outputDir.resolve(UNATTRIBUTED_JSON), mapper.writeValueAsBytes(records));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write reports to " + outputDir, e);
        }
        log.info("report.written dir={} profiles={} unattributed={}",
                outputDir, report.profilesWritten(), unattributed.size());
    }

    String toMarkdown(CoverageReport report, List<UnattributedRecord> unattributed, String generatedAt) {
        StringBuilder md = new StringBuilder();
        md.append("# Coverage Report\n\n");
        md.append("Generated: ").append(generatedAt).append("\n\n");

        md.append("## Entities\n\n");
        md.append("| Measure | Count |\n|---|---:|\n");
        row(md, "Entities in index", report.totalEntities());
        row(md, "Profiles written", report.profilesWritten());
        row(md, "Failed entities", report.failedEntities().size());
        row(md, "Area-weighted geography", report.areaWeightedEntities());
        row(md, "State fallback geography (approximate)", report.fallbackEntities());
        row(md, "No geography", report.entitiesWithoutGeography());
        row(md, "Entities with awards", report.entitiesWithAwards());
        row(md, "Hazard overrides applied", report.hazardOverrides());
        md.append('\n');

        md.append("## Award Matching\n\n");
        md.append("| Outcome | Records |\n|---|---:|\n");
        for (Map.Entry<String, Long> e : report.matchOutcomes().entrySet()) {
            row(md, e.getKey(), e.getValue());
        }
        row(md, "of which consortium", report.consortiumRecords());
        md.append('\n');
        md.append("| Input | Records |\n|---|---:|\n");
        row(md, "Award records read", report.awardRecordsRead());
        row(md, "Duplicates removed", report.duplicateAwards());
        row(md, "Malformed award rows", report.malformedAwards());
        row(md, "Malformed hazard rows", report.malformedHazardRows());
        row(md, "Unattributed records", report.unattributedRecords());
        md.append("| Unattributed amount | ").append(plain(report.unattributedAmount())).append(" |\n\n");

        md.append("## Hazard Metric Coverage\n\n");
        md.append("| Metric | Full | Partial | None |\n|---|---:|---:|---:|\n");
        for (Map.Entry<String, MetricCoverageCounts> e : report.metricCoverage().entrySet()) {
            MetricCoverageCounts c = e.getValue();
            md.append("| ").append(e.getKey()).append(" | ").append(c.full()).append(" | ")
                    .append(c.partial()).append(" | ").append(c.none()).append(" |\n");
        }

        List<UnattributedRecord> ambiguous = unattributed.stream()
                .filter(r -> r.reason() == UnattributedReason.AMBIGUOUS)
                .toList();
        if (!ambiguous.isEmpty()) {
            md.append("\n## Ambiguous Records\n\n");
            md.append("| Record | Recipient | Candidates |\n|---|---|---|\n");
            for (UnattributedRecord r : ambiguous) {
                md.append("| ").append(r.recordId()).append(" | ").append(r.recipientName()).append(" | ")
                        .append(candidatesText(r.candidates())).append(" |\n");
            }
        }

        if (!report.failedEntities().isEmpty()) {
            md.append("\n## Failed Entities\n\n");
            md.append(report.failedEntities().stream().map(id -> "- " + id).collect(Collectors.joining("\n")));
            md.append('\n');
        }
        return md.toString();
    }

    static String candidatesText(List<MatchCandidate> candidates) {
        return candidates.stream()
                .map(c -> c.entityId() + " (" + c.score() + ")")
                .collect(Collectors.joining(", "));
    }

    private static void row(StringBuilder md, String label, long value) {
        md.append("| ").append(label).append(" | ").append(value).append(" |\n");
    }

    private static String plain(BigDecimal amount) {
        return amount.toPlainString();
    }
}
