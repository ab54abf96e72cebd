package com.name.suggestion.ranking;

/**
 * A ranked candidate with its composite score.
 *
 * @param name  candidate name
 * @param value the caller payload, passed through unchanged
 * @param score composite relevance score
 * @param <T>   payload type
 */
public record ScoredCandidate<T>(String name, T value, double score) {
}
