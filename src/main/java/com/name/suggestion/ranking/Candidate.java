package com.name.suggestion.ranking;

/**
 * A known name together with an opaque payload describing what it represents.
 * The payload is never inspected by the ranking engine.
 *
 * @param name  the name compared against the unknown name; null or empty entries are discarded when ranking
 * @param value the caller-defined payload
 * @param <T>   payload type
 */
public record Candidate<T>(String name, T value) {

    public static <T> Candidate<T> of(String name, T value) {
        return new Candidate<>(name, value);
    }

    /**
     * Creates a candidate whose payload is its own name.
     */
    public static Candidate<String> ofName(String name) {
        return new Candidate<>(name, name);
    }

    /**
     * Returns true if this candidate has a non-empty name.
     */
    public boolean isValid() {
        return name != null && !name.isEmpty();
    }
}
