package com.entity.profiling.core.model;

import java.util.Objects;

/**
 * A scored fuzzy-tier candidate.
 *
 * @param entityId    candidate entity id
 * @param matchedName the entity name (display name or alias) that produced the score
 * @param score       similarity on the 0-100 scale
 */
public record MatchCandidate(String entityId, String matchedName, double score) {

    public MatchCandidate {
        Objects.requireNonNull(entityId, "entityId is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100");
        }
    }
}
