package com.name.suggestion.similarity;

/**
 * Jaro similarity.
 * Counts characters that match within a sliding window and penalizes matched characters that appear out of order.
 */
public class JaroSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = s1 == null ? "" : s1;
        String b = s2 == null ? "" : s2;

        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int aLength = a.length();
        int bLength = b.length();

        int matchWindow = Math.max(0, Math.max(aLength, bLength) / 2 - 1);

        boolean[] aMatches = new boolean[aLength];
        boolean[] bMatches = new boolean[bLength];
        int matches = findMatches(a, b, matchWindow, aMatches, bMatches);

        if (matches == 0) {
            return 0.0;
        }

        int transpositions = countTranspositions(a, b, aMatches, bMatches);

        // Jaro formula: (m/|a| + m/|b| + (m-t/2)/m) / 3
        double m = matches;
        double t = transpositions / 2.0;
        return ((m / aLength) + (m / bLength) + ((m - t) / m)) / 3.0;
    }

    @Override
    public String getName() {
        return "Jaro";
    }

    private int findMatches(String a, String b, int matchWindow, boolean[] aMatches, boolean[] bMatches) {
        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, b.length());

            for (int j = start; j < end; j++) {
                if (bMatches[j] || a.charAt(i) != b.charAt(j)) {
                    continue;
                }
                aMatches[i] = true;
                bMatches[j] = true;
                matches++;
                break;
            }
        }
        return matches;
    }

    /**
     * Returns the raw count of positions where the matched characters of both strings differ.
     */
    private int countTranspositions(String a, String b, boolean[] aMatches, boolean[] bMatches) {
        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < a.length(); i++) {
            if (!aMatches[i]) {
                continue;
            }
            while (!bMatches[k]) {
                k++;
            }
            if (a.charAt(i) != b.charAt(k)) {
                transpositions++;
            }
            k++;
        }
        return transpositions;
    }
}
