package com.name.suggestion.similarity;

/**
 * Detailed breakdown of a composite score.
 *
 * @param baseSimilarity   Jaro-Winkler similarity of the normalized strings
 * @param exactBonus       exact normalized match bonus
 * @param containmentBonus substring containment bonus
 * @param tokenBonus       token overlap bonus
 * @param lengthPenalty    penalty for candidates longer than the query (non-negative)
 */
public record ScoreBreakdown(
        double baseSimilarity,
        double exactBonus,
        double containmentBonus,
        double tokenBonus,
        double lengthPenalty
) {

    /**
     * Returns the composite score.
     */
    public double totalScore() {
        return baseSimilarity + exactBonus + containmentBonus + tokenBonus - lengthPenalty;
    }

    @Override
    public String toString() {
        return String.format(
                "ScoreBreakdown{base=%.4f, exact=%.2f, containment=%.2f, tokens=%.2f, penalty=%.2f, total=%.4f}",
                baseSimilarity, exactBonus, containmentBonus, tokenBonus, lengthPenalty, totalScore());
    }
}
