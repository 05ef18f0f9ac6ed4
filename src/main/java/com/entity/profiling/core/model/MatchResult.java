package com.entity.profiling.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of resolving one raw recipient name against the canonical entity index.
 * Transient: computed per input record and never persisted beyond the run.
 */
public record MatchResult(
        String entityId,
        double confidence,
        MatchMethod method,
        List<MatchCandidate> ambiguousCandidates,
        String matchedName,
        String reason
) {
    public static final String REASON_CONSORTIUM = "consortium";

    public MatchResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(method, "method is required");
        ambiguousCandidates = ambiguousCandidates != null ? List.copyOf(ambiguousCandidates) : List.of();
        if (method == MatchMethod.AMBIGUOUS && ambiguousCandidates.size() < 2) {
            throw new IllegalArgumentException("Ambiguous result needs at least two candidates");
        }
        if (method != MatchMethod.AMBIGUOUS && !ambiguousCandidates.isEmpty()) {
            throw new IllegalArgumentException("Candidates are only carried by ambiguous results");
        }
        if ((method == MatchMethod.ALIAS || method == MatchMethod.FUZZY) && entityId == null) {
            throw new IllegalArgumentException("Attributed result requires an entityId");
        }
    }

    public static MatchResult alias(String entityId, String matchedName) {
        return new MatchResult(entityId, 1.0, MatchMethod.ALIAS, List.of(), matchedName, "alias table hit");
    }

    public static MatchResult fuzzy(String entityId, double confidence, String matchedName, String reason) {
        return new MatchResult(entityId, confidence, MatchMethod.FUZZY, List.of(), matchedName, reason);
    }

    public static MatchResult none(String reason) {
        return new MatchResult(null, 0.0, MatchMethod.NONE, List.of(), null, reason);
    }

    /**
     * Creates the no-attribution result used for consortium and inter-organization recipients.
     */
    public static MatchResult consortium() {
        return none(REASON_CONSORTIUM);
    }

    public static MatchResult ambiguous(List<MatchCandidate> candidates) {
        return new MatchResult(null, 0.0, MatchMethod.AMBIGUOUS, candidates, null,
                candidates.size() + " candidates within tie margin");
    }

    /**
     * Returns true if the record may contribute to an entity's award summary.
     */
    public boolean isAttributed() {
        return method == MatchMethod.ALIAS || method == MatchMethod.FUZZY;
    }

    public boolean isConsortium() {
        return method == MatchMethod.NONE && REASON_CONSORTIUM.equals(reason);
    }
}
