package com.name.suggestion.similarity;

/**
 * Bonus and penalty amounts applied by {@link CompositeSimilarityScorer} on top of the Jaro-Winkler base.
 *
 * @param exactMatchBonus       added when both normalized strings are equal
 * @param containmentBonus      added when one normalized string contains the other
 * @param equalTokenBonus       added per pair of equal tokens
 * @param prefixTokenBonus      added per pair of tokens where one is a prefix of the other
 * @param multiTokenBonus       added once when at least {@code multiTokenThreshold} token pairs matched
 * @param multiTokenThreshold   number of matched token pairs that triggers {@code multiTokenBonus}
 * @param lengthPenaltyPerChar  subtracted per character the candidate is longer than the query
 */
public record ScoringWeights(
        double exactMatchBonus,
        double containmentBonus,
        double equalTokenBonus,
        double prefixTokenBonus,
        double multiTokenBonus,
        int multiTokenThreshold,
        double lengthPenaltyPerChar
) {
    public ScoringWeights {
        if (exactMatchBonus < 0 || containmentBonus < 0 || equalTokenBonus < 0
                || prefixTokenBonus < 0 || multiTokenBonus < 0 || lengthPenaltyPerChar < 0) {
            throw new IllegalArgumentException("Bonuses and penalties must be non-negative");
        }
        if (multiTokenThreshold < 1) {
            throw new IllegalArgumentException("multiTokenThreshold must be >= 1, got " + multiTokenThreshold);
        }
    }

    /**
     * Default weights used by every diagnostic category.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(0.3, 0.2, 0.2, 0.1, 0.2, 2, 0.01);
    }
}
