package com.name.suggestion.diagnostic;

import com.name.suggestion.cache.CandidatePoolCache;
import com.name.suggestion.context.ContextualSuggester;
import com.name.suggestion.context.PrioritizedSuggestion;
import com.name.suggestion.context.QualifiedNameMatcher;
import com.name.suggestion.context.SymbolOrigin;
import com.name.suggestion.logging.LogContext;
import com.name.suggestion.metrics.MetricsService;
import com.name.suggestion.metrics.NoOpMetricsService;
import com.name.suggestion.ranking.Candidate;
import com.name.suggestion.ranking.CandidateRanker;
import com.name.suggestion.ranking.ScoredCandidate;
import com.name.suggestion.ranking.ScoredName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Produces "Did you mean" reports for unresolved names.
 *
 * <p>The ranker returns its top candidates regardless of absolute score; this service applies
 * the category's minimum score on top, renders the message and records metrics.
 * A service instance holds no per-call state and can be shared between threads.</p>
 */
public class SuggestionService {
    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    private final CandidateRanker ranker;
    private final ContextualSuggester contextualSuggester;
    private final QualifiedNameMatcher qualifiedNameMatcher;
    private final SuggestionMessageFormatter messageFormatter;
    private final MetricsService metrics;

    public SuggestionService() {
        this(new CandidateRanker(), new ContextualSuggester(), new QualifiedNameMatcher(),
                new SuggestionMessageFormatter(), new NoOpMetricsService());
    }

    public SuggestionService(MetricsService metrics) {
        this(new CandidateRanker(), new ContextualSuggester(), new QualifiedNameMatcher(),
                new SuggestionMessageFormatter(), metrics);
    }

    public SuggestionService(CandidateRanker ranker,
                             ContextualSuggester contextualSuggester,
                             QualifiedNameMatcher qualifiedNameMatcher,
                             SuggestionMessageFormatter messageFormatter,
                             MetricsService metrics) {
        this.ranker = Objects.requireNonNull(ranker, "ranker is required");
        this.contextualSuggester = Objects.requireNonNull(contextualSuggester, "contextualSuggester is required");
        this.qualifiedNameMatcher = Objects.requireNonNull(qualifiedNameMatcher, "qualifiedNameMatcher is required");
        this.messageFormatter = Objects.requireNonNull(messageFormatter, "messageFormatter is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Suggests candidates from a single pool.
     *
     * @param category  diagnostic category, decides the minimum score and the message
     * @param unknown   the unresolved name
     * @param container containing element named in the message (type, method), may be null
     * @param pool      candidate pool, may be null
     * @param formatter renders each suggested payload
     */
    public <T> SuggestionReport<T> suggest(DiagnosticCategory category, String unknown, String container,
                                           Iterable<Candidate<T>> pool, PayloadFormatter<T> formatter) {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(formatter, "formatter is required");

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forSuggestion(LogContext.generateCorrelationId(), category.name())) {
            List<ScoredCandidate<T>> ranked = ranker.rankKeyed(unknown, pool);
            List<ScoredCandidate<T>> accepted = new ArrayList<>();
            for (ScoredCandidate<T> candidate : ranked) {
                if (candidate.score() >= category.minimumScore()) {
                    accepted.add(candidate);
                }
            }
            return buildReport(category, unknown, container, accepted, formatter, start);
        }
    }

    /**
     * Suggests candidates from a pool held in a caller-owned cache, loading it on a miss.
     * A loader failure is logged and produces a report without suggestions.
     */
    public <T> SuggestionReport<T> suggest(DiagnosticCategory category, String unknown, String container,
                                           String poolKey, CandidatePoolCache<T> cache,
                                           Supplier<List<Candidate<T>>> loader, PayloadFormatter<T> formatter) {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(cache, "cache is required");

        List<Candidate<T>> pool;
        try (LogContext ctx = LogContext.forPoolLoad(LogContext.generateCorrelationId(), poolKey)) {
            pool = cache.getOrLoad(poolKey, loader);
        } catch (RuntimeException e) {
            log.warn("Failed to load candidate pool '{}' for {} '{}'", poolKey, category, unknown, e);
            metrics.incrementPoolLoadFailure(category);
            pool = List.of();
        }
        return suggest(category, unknown, container, pool, formatter);
    }

    /**
     * Suggests candidates gathered from several scopes, favouring those closest to the usage site.
     * The category threshold applies to the string similarity; reported scores include the origin bonus.
     */
    public <T> SuggestionReport<T> suggestInContext(DiagnosticCategory category, String unknown, String container,
                                                    Map<SymbolOrigin, ? extends Iterable<Candidate<T>>> pools,
                                                    PayloadFormatter<T> formatter) {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(formatter, "formatter is required");

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forSuggestion(LogContext.generateCorrelationId(), category.name())) {
            List<PrioritizedSuggestion<T>> prioritized = contextualSuggester.suggest(unknown, pools);
            List<ScoredCandidate<T>> accepted = new ArrayList<>();
            for (PrioritizedSuggestion<T> suggestion : prioritized) {
                if (suggestion.similarityScore() >= category.minimumScore()) {
                    accepted.add(new ScoredCandidate<>(suggestion.name(), suggestion.value(), suggestion.finalScore()));
                }
            }
            return buildReport(category, unknown, container, accepted, formatter, start);
        }
    }

    /**
     * Suggests dotted names (namespaces, packages) for an unknown dotted name.
     */
    public SuggestionReport<String> suggestQualifiedName(String unknown, Iterable<String> knownNames) {
        DiagnosticCategory category = DiagnosticCategory.NAMESPACE_NOT_FOUND;
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forSuggestion(LogContext.generateCorrelationId(), category.name())) {
            List<ScoredCandidate<String>> matches = new ArrayList<>();
            for (ScoredName match : qualifiedNameMatcher.findSimilar(unknown, knownNames)) {
                matches.add(new ScoredCandidate<>(match.name(), match.name(), match.score()));
            }
            return buildReport(category, unknown, null, matches, PayloadFormatter.names(), start);
        }
    }

    private <T> SuggestionReport<T> buildReport(DiagnosticCategory category, String unknown, String container,
                                                List<ScoredCandidate<T>> suggestions,
                                                PayloadFormatter<T> formatter, long startNanos) {
        String message = messageFormatter.formatMessage(category, unknown, container, suggestions, formatter);

        metrics.recordSuggestionDuration(category, Duration.ofNanos(System.nanoTime() - startNanos));
        metrics.recordSuggestionCount(category, suggestions.size());
        if (suggestions.isEmpty()) {
            metrics.incrementNoSuggestions(category);
            log.debug("No suggestions for {} '{}'", category, unknown);
        } else {
            metrics.recordTopScore(suggestions.get(0).score());
            log.debug("{} suggestions for {} '{}', best '{}' ({})",
                    suggestions.size(), category, unknown, suggestions.get(0).name(), suggestions.get(0).score());
        }

        return new SuggestionReport<>(category, unknown, suggestions, message);
    }
}
