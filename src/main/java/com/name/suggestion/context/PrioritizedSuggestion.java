package com.name.suggestion.context;

import java.util.Objects;

/**
 * A suggestion carrying both its string similarity and the origin of the suggested symbol.
 *
 * @param name            candidate name
 * @param value           caller payload
 * @param similarityScore composite similarity of the name
 * @param origin          where the symbol was found
 * @param <T>             payload type
 */
public record PrioritizedSuggestion<T>(String name, T value, double similarityScore, SymbolOrigin origin) {

    public PrioritizedSuggestion {
        Objects.requireNonNull(origin, "origin is required");
    }

    /**
     * Similarity plus the origin bonus.
     */
    public double finalScore() {
        return similarityScore + origin.bonus();
    }
}
