package com.name.suggestion.metrics;

import com.name.suggestion.diagnostic.DiagnosticCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code suggestion.duration} Timer (tag: category)</li>
 *   <li>{@code suggestion.count} DistributionSummary (tag: category)</li>
 *   <li>{@code suggestion.top.score} DistributionSummary</li>
 *   <li>{@code suggestion.none} Counter (tag: category)</li>
 *   <li>{@code suggestion.pool.failure} Counter (tag: category)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<DiagnosticCategory, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<DiagnosticCategory, DistributionSummary> countCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary topScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.topScoreSummary = DistributionSummary.builder("suggestion.top.score")
                .description("Distribution of the best suggestion score per lookup")
                .register(registry);
    }

    @Override
    public void recordSuggestionDuration(DiagnosticCategory category, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(category, c ->
                Timer.builder("suggestion.duration")
                        .description("Duration of suggestion lookups")
                        .tag("category", c.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordSuggestionCount(DiagnosticCategory category, int count) {
        DistributionSummary summary = countCache.computeIfAbsent(category, c ->
                DistributionSummary.builder("suggestion.count")
                        .description("Number of suggestions returned per lookup")
                        .tag("category", c.name())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordTopScore(double score) {
        topScoreSummary.record(score);
    }

    @Override
    public void incrementNoSuggestions(DiagnosticCategory category) {
        counter("suggestion.none", "Number of lookups without any suggestion", category).increment();
    }

    @Override
    public void incrementPoolLoadFailure(DiagnosticCategory category) {
        counter("suggestion.pool.failure", "Number of candidate pools that failed to load", category).increment();
    }

    private Counter counter(String name, String description, DiagnosticCategory category) {
        String key = name + ":" + category.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("category", category.name())
                        .register(registry));
    }
}
