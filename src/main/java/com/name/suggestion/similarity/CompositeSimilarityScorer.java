package com.name.suggestion.similarity;

import com.name.suggestion.text.IdentifierNormalizer;
import com.name.suggestion.text.IdentifierTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Composite relevance score of a candidate name for an unknown name.
 * Formula: score = jaroWinkler(normalized) + exact + containment + tokens - lengthPenalty
 *
 * <p>The result is a ranking metric, not a probability: bonuses push it above 1.0
 * (an exact match scores at least 1.5) and the length penalty can push it below 0.0.</p>
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final JaroWinklerSimilarity jaroWinkler;
    private final IdentifierNormalizer normalizer;
    private final IdentifierTokenizer tokenizer;
    private final ScoringWeights weights;

    public CompositeSimilarityScorer() {
        this(ScoringWeights.defaults());
    }

    public CompositeSimilarityScorer(ScoringWeights weights) {
        this.jaroWinkler = new JaroWinklerSimilarity();
        this.normalizer = new IdentifierNormalizer();
        this.tokenizer = new IdentifierTokenizer();
        this.weights = weights;
    }

    /**
     * Computes the composite score.
     *
     * @param unknown   the unresolved name
     * @param candidate a known name
     */
    @Override
    public double compute(String unknown, String candidate) {
        return computeWithBreakdown(unknown, candidate).totalScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    /**
     * Computes the composite score together with each of its components.
     */
    public ScoreBreakdown computeWithBreakdown(String unknown, String candidate) {
        String query = unknown == null ? "" : unknown;
        String target = candidate == null ? "" : candidate;

        String normQuery = normalizer.normalize(query);
        String normTarget = normalizer.normalize(target);

        double base = jaroWinkler.compute(normQuery, normTarget);
        double exact = normQuery.equals(normTarget) ? weights.exactMatchBonus() : 0.0;
        boolean contains = normTarget.contains(normQuery) || normQuery.contains(normTarget);
        double containment = contains ? weights.containmentBonus() : 0.0;
        double tokens = tokenBonus(query, target);
        double penalty = Math.max(0, target.length() - query.length()) * weights.lengthPenaltyPerChar();

        ScoreBreakdown breakdown = new ScoreBreakdown(base, exact, containment, tokens, penalty);
        if (log.isTraceEnabled()) {
            log.trace("Composite score for '{}' vs '{}': {}", query, target, breakdown);
        }
        return breakdown;
    }

    /**
     * Gets the current weights configuration.
     */
    public ScoringWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public CompositeSimilarityScorer withWeights(ScoringWeights newWeights) {
        return new CompositeSimilarityScorer(newWeights);
    }

    private double tokenBonus(String query, String target) {
        Set<String> queryTokens = new LinkedHashSet<>(tokenizer.splitIdentifier(query));
        Set<String> targetTokens = new LinkedHashSet<>(tokenizer.splitIdentifier(target));

        double bonus = 0.0;
        int matched = 0;
        for (String tq : queryTokens) {
            for (String tc : targetTokens) {
                if (tq.equals(tc)) {
                    bonus += weights.equalTokenBonus();
                    matched++;
                } else if (tq.startsWith(tc) || tc.startsWith(tq)) {
                    bonus += weights.prefixTokenBonus();
                    matched++;
                }
            }
        }

        if (matched >= weights.multiTokenThreshold()) {
            bonus += weights.multiTokenBonus();
        }
        return bonus;
    }
}
