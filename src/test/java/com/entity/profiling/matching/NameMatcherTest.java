package com.entity.profiling.matching;

import com.entity.profiling.cache.CacheConfig;
import com.entity.profiling.cache.CaffeineMatchCache;
import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.CanonicalEntity;
import com.entity.profiling.core.model.MatchCandidate;
import com.entity.profiling.core.model.MatchMethod;
import com.entity.profiling.core.model.MatchResult;
import com.entity.profiling.index.CanonicalEntityIndex;
import com.entity.profiling.metrics.MetricsService;
import com.entity.profiling.rules.DefaultNormalizationRules;
import com.entity.profiling.similarity.SimilarityAlgorithm;
import com.entity.profiling.similarity.TokenSortSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NameMatcherTest {

    private static final List<CanonicalEntity> ENTITIES = List.of(
            new CanonicalEntity("E1", "Test Nation of ABC", List.of("TEST NATION OF ABC"), List.of("AZ")),
            new CanonicalEntity("E2", "Sample Pueblo", List.of(), List.of("NM")),
            new CanonicalEntity("E3", "Other Band of XYZ", List.of("XYZ Band"), List.of("OK")));

    @Mock
    private SimilarityAlgorithm similarity;

    private CanonicalEntityIndex index;

    /** Pairwise scores keyed by "input|candidate"; anything else scores 0. */
    private final Map<String, Double> scores = new HashMap<>();

    @BeforeEach
    void setUp() {
        index = new CanonicalEntityIndex(ENTITIES, DefaultNormalizationRules.createDefaultEngine());
    }

    private void stubScores() {
        when(similarity.compute(anyString(), anyString()))
                .thenAnswer(inv -> scores.getOrDefault(inv.getArgument(0) + "|" + inv.getArgument(1), 0.0));
    }

    private NameMatcher matcher(MatcherOptions options) {
        return new NameMatcher(index, similarity, options);
    }

    @Nested
    @DisplayName("Alias tier")
    class AliasTier {

        @Test
        @DisplayName("An alias table hit matches with confidence 1.0 without fuzzy scoring")
        void aliasHit() {
            MatchResult result = matcher(MatcherOptions.defaults()).match("Test Nation of ABC");

            assertEquals(MatchMethod.ALIAS, result.method());
            assertEquals("E1", result.entityId());
            assertEquals(1.0, result.confidence());
            assertTrue(result.isAttributed());
            verifyNoInteractions(similarity);
        }

        @Test
        @DisplayName("Normalization makes boilerplate variants hit the alias table")
        void normalizedVariantHits() {
            MatchResult result = matcher(MatcherOptions.defaults()).match("The XYZ Band, Inc.");

            assertEquals(MatchMethod.ALIAS, result.method());
            assertEquals("E3", result.entityId());
        }
    }

    @Nested
    @DisplayName("Fuzzy tier")
    class FuzzyTier {

        @Test
        @DisplayName("A unique candidate above the threshold matches with confidence score/100")
        void uniqueCandidateAboveThreshold() {
            scores.put("tst natoin abc|test nation of abc", 0.88);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("Tst Natoin ABC");

            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals("E1", result.entityId());
            assertEquals(0.88, result.confidence(), 1e-9);
            assertEquals("test nation of abc", result.matchedName());
        }

        @Test
        @DisplayName("Candidates within the tie margin produce AMBIGUOUS with every tied candidate")
        void tieIsAmbiguous() {
            scores.put("sample nation|test nation of abc", 0.90);
            scores.put("sample nation|sample pueblo", 0.89);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("Sample Nation");

            assertEquals(MatchMethod.AMBIGUOUS, result.method());
            assertNull(result.entityId());
            assertFalse(result.isAttributed());
            assertEquals(List.of("E1", "E2"),
                    result.ambiguousCandidates().stream().map(MatchCandidate::entityId).toList());
            assertEquals(90.0, result.ambiguousCandidates().get(0).score(), 1e-9);
            assertEquals(89.0, result.ambiguousCandidates().get(1).score(), 1e-9);
        }

        @Test
        @DisplayName("A gap exactly equal to the tie margin is still ambiguous")
        void marginIsInclusive() {
            scores.put("sample nation|test nation of abc", 0.90);
            scores.put("sample nation|sample pueblo", 0.88);
            stubScores();

            assertEquals(MatchMethod.AMBIGUOUS, matcher(MatcherOptions.defaults()).match("Sample Nation").method());
        }

        @Test
        @DisplayName("A gap wider than the tie margin matches the top candidate")
        void clearWinner() {
            scores.put("sample nation|test nation of abc", 0.90);
            scores.put("sample nation|sample pueblo", 0.879);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("Sample Nation");
            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals("E1", result.entityId());
        }

        @Test
        @DisplayName("A top score below the threshold never force-matches")
        void belowThreshold() {
            scores.put("abc tribal nation|test nation of abc", 0.84);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("ABC Tribal Nation");
            assertEquals(MatchMethod.NONE, result.method());
            assertNull(result.entityId());
        }

        @Test
        @DisplayName("The best alias of an entity is used for its score")
        void bestNamePerEntity() {
            scores.put("xyz people|other band of xyz", 0.70);
            scores.put("xyz people|xyz band", 0.95);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("XYZ People");
            assertEquals("E3", result.entityId());
            assertEquals(0.95, result.confidence(), 1e-9);
            assertEquals("xyz band", result.matchedName());
        }
    }

    @Nested
    @DisplayName("State validation")
    class StateValidation {

        @Test
        @DisplayName("A mismatched state qualifier drops a borderline match to NONE")
        void mismatchRejects() {
            scores.put("abc tribal nation|test nation of abc", 0.88);
            stubScores();

            MatchResult result = matcher(MatcherOptions.defaults()).match("ABC Tribal Nation, NM");
            assertEquals(MatchMethod.NONE, result.method());
        }

        @Test
        @DisplayName("The penalty is deducted when the match survives it")
        void mismatchPenalizes() {
            scores.put("abc tribal nation|test nation of abc", 0.88);
            stubScores();
            MatcherOptions options = MatcherOptions.builder().fuzzyThreshold(70).build();

            MatchResult result = matcher(options).match("ABC Tribal Nation", "NM");
            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals(0.73, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("A matching declared state keeps full confidence")
        void matchingState() {
            scores.put("abc tribal nation|test nation of abc", 0.88);
            stubScores();

            AwardRecord record = new AwardRecord("R1", "ABC Tribal Nation", BigDecimal.TEN, "P", "2024", "AZ");
            MatchResult result = matcher(MatcherOptions.defaults()).match(record);
            assertEquals(0.88, result.confidence(), 1e-9);
        }

        @Test
        @DisplayName("Validation can be switched off")
        void disabled() {
            scores.put("abc tribal nation|test nation of abc", 0.88);
            stubScores();
            MatcherOptions options = MatcherOptions.builder().stateValidationEnabled(false).build();

            MatchResult result = matcher(options).match("ABC Tribal Nation", "NM");
            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals(0.88, result.confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Special inputs")
    class SpecialInputs {

        @Test
        @DisplayName("Consortium recipients are never attributed")
        void consortium() {
            MatchResult result = matcher(MatcherOptions.defaults()).match("Inter Tribal Council of Arizona, Inc.");

            assertEquals(MatchMethod.NONE, result.method());
            assertTrue(result.isConsortium());
            verifyNoInteractions(similarity);
        }

        @Test
        @DisplayName("Invalid names are rejected before matching")
        void invalidName() {
            NameMatcher matcher = matcher(MatcherOptions.defaults());
            assertThrows(IllegalArgumentException.class, () -> matcher.match("   "));
            assertThrows(IllegalArgumentException.class, () -> matcher.match("bad\u0001name"));
        }

        @Test
        @DisplayName("A name that normalizes to nothing is NONE")
        void emptyAfterNormalization() {
            MatchResult result = matcher(MatcherOptions.defaults()).match("(-)");
            assertEquals(MatchMethod.NONE, result.method());
            verifyNoInteractions(similarity);
        }
    }

    @Nested
    @DisplayName("Caching and metrics")
    class CachingAndMetrics {

        @Test
        @DisplayName("A repeated name is served from the cache")
        void cachedOutcome() {
            scores.put("abc tribal nation|test nation of abc", 0.88);
            stubScores();
            MetricsService metrics = mock(MetricsService.class);
            NameMatcher matcher = new NameMatcher(index, similarity, MatcherOptions.defaults(),
                    null, new CaffeineMatchCache(CacheConfig.defaults()), metrics);

            MatchResult first = matcher.match("ABC Tribal Nation");
            int calls = mockingDetails(similarity).getInvocations().size();
            MatchResult second = matcher.match("abc  tribal nation");

            assertEquals(first, second);
            assertEquals(calls, mockingDetails(similarity).getInvocations().size());
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
            verify(metrics, times(2)).recordMatch(MatchMethod.FUZZY);
        }

        @Test
        @DisplayName("Every outcome is counted by method")
        void recordsOutcome() {
            MetricsService metrics = mock(MetricsService.class);
            NameMatcher matcher = new NameMatcher(index, similarity, MatcherOptions.defaults(),
                    null, null, metrics);

            matcher.match("Test Nation of ABC");
            matcher.match("Intertribal Consortium");

            verify(metrics).recordMatch(MatchMethod.ALIAS);
            verify(metrics).recordMatch(MatchMethod.NONE);
        }
    }

    @Nested
    @DisplayName("Real similarity")
    class RealSimilarity {

        @Test
        @DisplayName("A misspelling of a single entity matches it")
        void misspelling() {
            CanonicalEntityIndex navajo = new CanonicalEntityIndex(List.of(
                    new CanonicalEntity("N1", "Navajo Nation", List.of(), List.of("AZ", "NM", "UT")),
                    ENTITIES.get(0)), DefaultNormalizationRules.createDefaultEngine());
            NameMatcher matcher = new NameMatcher(navajo, new TokenSortSimilarity(), MatcherOptions.defaults());

            MatchResult result = matcher.match("NAVAHO NATION, AZ");
            assertEquals(MatchMethod.FUZZY, result.method());
            assertEquals("N1", result.entityId());
            assertEquals(0.9231, result.confidence(), 1e-4);
        }

        @Test
        @DisplayName("Results do not depend on entity registration order")
        void deterministic() {
            List<CanonicalEntity> shuffled = new ArrayList<>(ENTITIES);
            Collections.shuffle(shuffled, new Random(7));
            NameMatcher a = new NameMatcher(index, new TokenSortSimilarity(), MatcherOptions.defaults());
            NameMatcher b = new NameMatcher(
                    new CanonicalEntityIndex(shuffled, DefaultNormalizationRules.createDefaultEngine()),
                    new TokenSortSimilarity(), MatcherOptions.defaults());

            for (String name : List.of("Test Nation ABC", "Sampel Pueblo", "XYZ Band of Other", "Unknown")) {
                assertEquals(a.match(name), b.match(name), name);
            }
        }
    }
}
