package com.name.suggestion.ranking;

/**
 * Options for candidate ranking.
 * By default at most 5 results are returned and no minimum score is applied;
 * callers that want a relevance cutoff set {@link Builder#minimumScore(double)}.
 */
public class RankingOptions {

    private static final int DEFAULT_MAX_RESULTS = 5;

    /**
     * Marker for "no minimum score".
     */
    public static final double NO_MINIMUM_SCORE = Double.NEGATIVE_INFINITY;

    private final int maxResults;
    private final double minimumScore;

    private RankingOptions(Builder builder) {
        this.maxResults = builder.maxResults;
        this.minimumScore = builder.minimumScore;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public double getMinimumScore() {
        return minimumScore;
    }

    public boolean hasMinimumScore() {
        return minimumScore != NO_MINIMUM_SCORE;
    }

    /**
     * Creates default options: top 5, no cutoff.
     */
    public static RankingOptions defaults() {
        return builder().build();
    }

    /**
     * Creates default options with a minimum score.
     */
    public static RankingOptions withMinimumScore(double minimumScore) {
        return builder().minimumScore(minimumScore).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RankingOptions{maxResults=" + maxResults
                + ", minimumScore=" + (hasMinimumScore() ? minimumScore : "none") + '}';
    }

    public static class Builder {
        private int maxResults = DEFAULT_MAX_RESULTS;
        private double minimumScore = NO_MINIMUM_SCORE;

        public Builder maxResults(int maxResults) {
            if (maxResults <= 0) {
                throw new IllegalArgumentException("maxResults must be > 0");
            }
            this.maxResults = maxResults;
            return this;
        }

        public Builder minimumScore(double minimumScore) {
            if (Double.isNaN(minimumScore)) {
                throw new IllegalArgumentException("minimumScore must be a number");
            }
            this.minimumScore = minimumScore;
            return this;
        }

        public RankingOptions build() {
            return new RankingOptions(this);
        }
    }
}
