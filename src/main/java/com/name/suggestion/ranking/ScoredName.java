package com.name.suggestion.ranking;

/**
 * A ranked plain name with its composite score.
 */
public record ScoredName(String name, double score) {
}
