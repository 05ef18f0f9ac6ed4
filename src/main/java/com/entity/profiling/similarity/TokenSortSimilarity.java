package com.entity.profiling.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Word-order-insensitive similarity: both inputs are case-folded, split on
 * non-alphanumeric characters, sorted and re-joined before the delegate scores them.
 * "Tribe Hopi" and "hopi tribe" compare as identical.
 */
public class TokenSortSimilarity implements SimilarityAlgorithm {

    private final SimilarityAlgorithm delegate;

    public TokenSortSimilarity() {
        this(new IndelSimilarity());
    }

    public TokenSortSimilarity(SimilarityAlgorithm delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return delegate.compute(sortTokens(s1), sortTokens(s2));
    }

    @Override
    public String getName() {
        return "TokenSort(" + delegate.getName() + ")";
    }

    static String sortTokens(String input) {
        return Arrays.stream(input.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+"))
                .filter(token -> !token.isEmpty())
                .sorted()
                .collect(Collectors.joining(" "));
    }
}
