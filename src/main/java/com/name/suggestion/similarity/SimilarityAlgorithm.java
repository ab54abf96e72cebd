package com.name.suggestion.similarity;

/**
 * Interface for string similarity algorithms.
 * Implementations are stateless and never throw; a null argument is treated as an empty string.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score, between 0.0 and 1.0 for the bounded metrics
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
