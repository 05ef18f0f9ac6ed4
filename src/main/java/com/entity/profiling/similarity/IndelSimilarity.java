package com.entity.profiling.similarity;

/**
 * Indel distance-based similarity.
 * Only insertions and deletions are counted, so the distance is
 * {@code len1 + len2 - 2 * LCS} and the similarity is {@code 1 - distance / (len1 + len2)}.
 */
public class IndelSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int total = s1.length() + s2.length();
        int distance = total - 2 * longestCommonSubsequence(s1, s2);
        return 1.0 - ((double) distance / total);
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * Length of the longest common subsequence, with O(min(m,n)) space.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            char c = s2.charAt(j - 1);
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
