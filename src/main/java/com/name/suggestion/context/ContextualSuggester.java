package com.name.suggestion.context;

import com.name.suggestion.ranking.Candidate;
import com.name.suggestion.similarity.CompositeSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suggests symbols gathered from several scopes, favouring those closest to the usage site.
 *
 * <p>Each candidate is scored on its name alone; candidates below the minimum similarity
 * are dropped before the origin bonus is applied, so a bonus never rescues an unrelated name.
 * A symbol is identified by its name together with its payload: the same symbol offered by
 * several origins is kept once with its highest final score, while distinct symbols sharing
 * a name (overloads, same-named fields of different types) are all kept.</p>
 */
public class ContextualSuggester {
    private static final Logger log = LoggerFactory.getLogger(ContextualSuggester.class);

    private static final int DEFAULT_MAX_SUGGESTIONS = 5;
    private static final double DEFAULT_MIN_SIMILARITY = 0.3;

    private final CompositeSimilarityScorer scorer;
    private final int maxSuggestions;
    private final double minSimilarity;

    public ContextualSuggester() {
        this(new CompositeSimilarityScorer(), DEFAULT_MAX_SUGGESTIONS, DEFAULT_MIN_SIMILARITY);
    }

    public ContextualSuggester(CompositeSimilarityScorer scorer, int maxSuggestions, double minSimilarity) {
        if (maxSuggestions <= 0) {
            throw new IllegalArgumentException("maxSuggestions must be > 0");
        }
        this.scorer = scorer;
        this.maxSuggestions = maxSuggestions;
        this.minSimilarity = minSimilarity;
    }

    /**
     * Gathers prioritized suggestions from candidate pools keyed by origin.
     *
     * @param unknown the unresolved name
     * @param pools   candidate pools per origin; null pools are skipped
     * @param <T>     payload type
     * @return at most {@code maxSuggestions} suggestions ordered by final score, then similarity
     */
    public <T> List<PrioritizedSuggestion<T>> suggest(
            String unknown, Map<SymbolOrigin, ? extends Iterable<Candidate<T>>> pools) {
        if (unknown == null || unknown.isEmpty() || pools == null || pools.isEmpty()) {
            return List.of();
        }

        // Enum order makes the closer origin win ties during deduplication
        Map<SymbolOrigin, Iterable<Candidate<T>>> ordered = new EnumMap<>(SymbolOrigin.class);
        pools.forEach((origin, pool) -> {
            if (origin != null && pool != null) {
                ordered.put(origin, pool);
            }
        });

        Map<SymbolKey, PrioritizedSuggestion<T>> bestBySymbol = new LinkedHashMap<>();
        for (Map.Entry<SymbolOrigin, Iterable<Candidate<T>>> entry : ordered.entrySet()) {
            for (Candidate<T> candidate : entry.getValue()) {
                if (candidate == null || !candidate.isValid() || candidate.name().equals(unknown)) {
                    continue;
                }
                double similarity = scorer.compute(unknown, candidate.name());
                if (similarity < minSimilarity) {
                    continue;
                }
                PrioritizedSuggestion<T> suggestion = new PrioritizedSuggestion<>(
                        candidate.name(), candidate.value(), similarity, entry.getKey());
                bestBySymbol.merge(new SymbolKey(candidate.name(), candidate.value()), suggestion,
                        (existing, incoming) -> incoming.finalScore() > existing.finalScore() ? incoming : existing);
            }
        }

        List<PrioritizedSuggestion<T>> result = new ArrayList<>(bestBySymbol.values());
        result.sort(Comparator.comparingDouble((PrioritizedSuggestion<T> s) -> s.finalScore())
                .thenComparingDouble(s -> s.similarityScore())
                .reversed());

        List<PrioritizedSuggestion<T>> top = result.size() > maxSuggestions
                ? List.copyOf(result.subList(0, maxSuggestions))
                : List.copyOf(result);
        log.debug("Contextual suggestions for '{}': {} unique symbols, returning {}",
                unknown, result.size(), top.size());
        return top;
    }

    /**
     * Identity of a suggested symbol; payloads are compared with {@code equals}.
     */
    private record SymbolKey(String name, Object value) {
    }
}
