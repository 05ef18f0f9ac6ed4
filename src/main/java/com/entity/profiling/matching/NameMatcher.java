package com.entity.profiling.matching;

import com.entity.profiling.cache.MatchCache;
import com.entity.profiling.cache.NoOpMatchCache;
import com.entity.profiling.core.InputSanitizer;
import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.core.model.MatchCandidate;
import com.entity.profiling.core.model.MatchResult;
import com.entity.profiling.index.CanonicalEntityIndex;
import com.entity.profiling.metrics.MetricsService;
import com.entity.profiling.metrics.NoOpMetricsService;
import com.entity.profiling.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves raw recipient names to canonical entities in two short-circuiting tiers.
 *
 * <ol>
 *   <li>Alias tier: exact lookup of the normalized name in the alias table, confidence 1.0.</li>
 *   <li>Fuzzy tier: every entity is scored (0-100) on its best-matching name. The top
 *       candidate is accepted only when it reaches the threshold and no other entity
 *       scores within the tie margin of it; otherwise the result is NONE or AMBIGUOUS.
 *       An accepted candidate whose states exclude the recipient's state loses
 *       {@link MatcherOptions#getStateMismatchPenalty()} confidence and reverts to NONE
 *       if that drops it under the threshold.</li>
 * </ol>
 *
 * <p>Never force-matches: a false attribution is worse than a missed one. The matcher
 * is stateless apart from its cache and is safe to share between threads.</p>
 */
public class NameMatcher {
    private static final Logger log = LoggerFactory.getLogger(NameMatcher.class);

    private static final double TIE_EPSILON = 1e-9;

    private final CanonicalEntityIndex index;
    private final SimilarityAlgorithm similarity;
    private final MatcherOptions options;
    private final ConsortiumDetector consortiumDetector;
    private final MatchCache cache;
    private final MetricsService metrics;

    public NameMatcher(CanonicalEntityIndex index, SimilarityAlgorithm similarity, MatcherOptions options) {
        this(index, similarity, options, new ConsortiumDetector(), new NoOpMatchCache(), new NoOpMetricsService());
    }

    public NameMatcher(CanonicalEntityIndex index, SimilarityAlgorithm similarity, MatcherOptions options,
                       ConsortiumDetector consortiumDetector, MatchCache cache, MetricsService metrics) {
        this.index = Objects.requireNonNull(index, "index is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.options = options != null ? options : MatcherOptions.defaults();
        this.consortiumDetector = consortiumDetector != null ? consortiumDetector : new ConsortiumDetector();
        this.cache = cache != null ? cache : new NoOpMatchCache();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public MatcherOptions getOptions() {
        return options;
    }

    public MatchResult match(AwardRecord record) {
        return match(record.recipientName(), record.recipientState());
    }

    public MatchResult match(String rawName) {
        return match(rawName, null);
    }

    /**
     * Matches a raw recipient name.
     *
     * @param rawName        free-text recipient name
     * @param recipientState declared state code of the recipient, may be null
     * @throws IllegalArgumentException if the name is blank, oversized or contains control characters
     */
    public MatchResult match(String rawName, String recipientState) {
        InputSanitizer.validateRecipientName(rawName);

        MatchResult result;
        if (options.isConsortiumDetectionEnabled() && consortiumDetector.isConsortium(rawName)) {
            log.debug("match.consortium name='{}'", rawName);
            result = MatchResult.consortium();
        } else {
            String state = RecipientStates.resolve(recipientState, rawName);
            String normalized = index.normalizer().normalize(rawName);
            if (normalized.isEmpty()) {
                result = MatchResult.none("name is empty after normalization");
            } else {
                Optional<MatchResult> cached = cache.get(normalized, state);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    result = cached.get();
                } else {
                    metrics.recordCacheMiss();
                    result = resolve(normalized, state);
                    cache.put(normalized, state, result);
                }
            }
        }
        metrics.recordMatch(result.method());
        return result;
    }

    private MatchResult resolve(String normalized, String state) {
        Optional<String> aliasHit = index.lookupAlias(normalized);
        if (aliasHit.isPresent()) {
            log.debug("match.alias name='{}' entityId={}", normalized, aliasHit.get());
            return MatchResult.alias(aliasHit.get(), normalized);
        }
        return fuzzyMatch(normalized, state);
    }

    private MatchResult fuzzyMatch(String normalized, String state) {
        List<MatchCandidate> scored = scoreAll(normalized);
        if (scored.isEmpty()) {
            return MatchResult.none("no candidate names");
        }

        MatchCandidate top = scored.get(0);
        metrics.recordSimilarityScore(top.score());
        double threshold = options.getFuzzyThreshold();
        if (top.score() < threshold) {
            return MatchResult.none("best score " + top.score() + " below threshold " + threshold);
        }

        List<MatchCandidate> tied = new ArrayList<>();
        for (MatchCandidate candidate : scored) {
            if (top.score() - candidate.score() <= options.getTieMargin() + TIE_EPSILON) {
                tied.add(candidate);
            } else {
                break;
            }
        }
        if (tied.size() > 1) {
            log.info("match.ambiguous name='{}' candidates={}", normalized, tied);
            return MatchResult.ambiguous(tied);
        }

        double confidence = top.score() / 100.0;
        String reason = "token sort score " + top.score();
        if (options.isStateValidationEnabled() && state != null) {
            CanonicalEntity entity = index.get(top.entityId()).orElseThrow();
            if (!entity.geographicUnitIds().isEmpty() && !entity.touchesState(state)) {
                confidence = Math.max(0.0, confidence - options.getStateMismatchPenalty());
                if (confidence < threshold / 100.0) {
                    log.info("match.stateRejected name='{}' entityId={} state={} entityStates={}",
                            normalized, top.entityId(), state, entity.geographicUnitIds());
                    return MatchResult.none("state " + state + " not among candidate " + top.entityId() + " states");
                }
                reason = reason + ", state " + state + " mismatch penalty applied";
            }
        }
        log.debug("match.fuzzy name='{}' entityId={} score={}", normalized, top.entityId(), top.score());
        return MatchResult.fuzzy(top.entityId(), confidence, top.matchedName(), reason);
    }

    /**
     * Scores every entity on its best name, sorted by score descending then entity id.
     */
    private List<MatchCandidate> scoreAll(String normalized) {
        List<MatchCandidate> candidates = new ArrayList<>(index.size());
        for (CanonicalEntity entity : index.entities()) {
            MatchCandidate best = null;
            for (String name : index.normalizedNames(entity.id())) {
                double score = toScore(similarity.compute(normalized, name));
                if (best == null || score > best.score()) {
                    best = new MatchCandidate(entity.id(), name, score);
                }
            }
            if (best != null && best.score() > 0.0) {
                candidates.add(best);
            }
        }
        candidates.sort(Comparator.comparingDouble(MatchCandidate::score).reversed()
                .thenComparing(MatchCandidate::entityId));
        return candidates;
    }

    private static double toScore(double similarity) {
        double clamped = Math.max(0.0, Math.min(1.0, similarity));
        return Math.round(clamped * 10_000.0) / 100.0;
    }
}
