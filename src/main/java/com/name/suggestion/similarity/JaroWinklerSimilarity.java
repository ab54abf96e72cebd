package com.name.suggestion.similarity;

/**
 * Jaro-Winkler similarity algorithm.
 * Gives higher scores to strings that match from the beginning.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_SCALING_FACTOR = 0.1;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final JaroSimilarity jaro;
    private final double scalingFactor;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR);
    }

    public JaroWinklerSimilarity(double scalingFactor) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        this.jaro = new JaroSimilarity();
        this.scalingFactor = scalingFactor;
    }

    @Override
    public double compute(String s1, String s2) {
        String a = s1 == null ? "" : s1;
        String b = s2 == null ? "" : s2;

        double jaroSimilarity = jaro.compute(a, b);
        int prefixLength = commonPrefixLength(a, b);

        // Jaro-Winkler formula: jw = jaro + (prefix * scalingFactor * (1 - jaro))
        return jaroSimilarity + (prefixLength * scalingFactor * (1.0 - jaroSimilarity));
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    private int commonPrefixLength(String a, String b) {
        int prefixLength = 0;
        int maxPrefixLength = Math.min(MAX_PREFIX_LENGTH, Math.min(a.length(), b.length()));
        while (prefixLength < maxPrefixLength && a.charAt(prefixLength) == b.charAt(prefixLength)) {
            prefixLength++;
        }
        return prefixLength;
    }
}
