package com.entity.profiling.profile;

import com.entity.profiling.core.AtomicFiles;
import com.entity.profiling.core.InputSanitizer;
import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.CoverageMetadata;
import com.entity.profiling.core.model.EntityProfile;
import com.entity.profiling.core.model.HazardSummary;
import com.entity.profiling.metrics.MetricsService;
import com.entity.profiling.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists one profile per entity as {@code <profilesDir>/<entityId>.json}.
 * Each file is replaced atomically, so a reader sees either the previous profile or
 * the complete new one. The output carries no timestamps: the same inputs produce
 * byte-identical files.
 */
public class ProfileWriter {
    private static final Logger log = LoggerFactory.getLogger(ProfileWriter.class);

    private final Path profilesDir;
    private final ObjectMapper mapper;
    private final MetricsService metrics;

    public ProfileWriter(Path profilesDir) {
        this(profilesDir, JsonSupport.mapper(), new NoOpMetricsService());
    }

    public ProfileWriter(Path profilesDir, ObjectMapper mapper, MetricsService metrics) {
        this.profilesDir = profilesDir;
        this.mapper = mapper;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public Path write(String entityId, String displayName, HazardSummary hazardSummary,
                      AwardSummary awardSummary, CoverageMetadata coverageMetadata) {
        return write(new EntityProfile(entityId, displayName, hazardSummary, awardSummary, coverageMetadata));
    }

    /**
     * @return the profile file
     * @throws ProfileWriteException if the id is not a safe file name or the file cannot be written
     */
    public Path write(EntityProfile profile) {
        String entityId = profile.entityId();
        try {
            InputSanitizer.validateEntityId(entityId);
        } catch (IllegalArgumentException e) {
            metrics.incrementProfileFailure();
            throw new ProfileWriteException(entityId, e.getMessage(), e);
        }

        Path target = pathFor(entityId);
        try {
            AtomicFiles.write(target, mapper.writeValueAsBytes(profile));
        } catch (IOException e) {
            metrics.incrementProfileFailure();
            throw new ProfileWriteException(entityId,
                    "Failed to write profile for " + entityId + ": " + e.getMessage(), e);
        }
        metrics.incrementProfileWritten();
        log.debug("profile.written entityId={} path={}", entityId, target);
        return target;
    }

    public Path pathFor(String entityId) {
        return profilesDir.resolve(entityId + ".json");
    }

    public Path getProfilesDir() {
        return profilesDir;
    }
}
