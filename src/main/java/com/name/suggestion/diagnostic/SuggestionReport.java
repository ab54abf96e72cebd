package com.name.suggestion.diagnostic;

import com.name.suggestion.ranking.ScoredCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a suggestion lookup for one unresolved name.
 *
 * @param category    diagnostic category
 * @param unknownName the unresolved name
 * @param suggestions suggestions that passed the category threshold, best first
 * @param message     rendered diagnostic message
 * @param <T>         payload type
 */
public record SuggestionReport<T>(
        DiagnosticCategory category,
        String unknownName,
        List<ScoredCandidate<T>> suggestions,
        String message
) {
    public SuggestionReport {
        Objects.requireNonNull(category, "category is required");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }

    /**
     * Returns the best suggestion's name, or null when there is none.
     */
    public String bestName() {
        return suggestions.isEmpty() ? null : suggestions.get(0).name();
    }
}
