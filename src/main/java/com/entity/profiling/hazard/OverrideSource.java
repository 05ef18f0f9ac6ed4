package com.entity.profiling.hazard;

import com.entity.profiling.core.model.HazardOverride;

import java.util.Optional;

/**
 * A specialized data source whose score for one hazard type supersedes the general
 * model's aggregated score, e.g. a dedicated wildfire risk dataset.
 */
public interface OverrideSource {

    Optional<HazardOverride> overrideFor(String entityId, String hazardCode);

    /**
     * Source that never overrides.
     */
    static OverrideSource none() {
        return (entityId, hazardCode) -> Optional.empty();
    }
}
