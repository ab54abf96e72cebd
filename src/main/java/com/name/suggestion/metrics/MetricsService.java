package com.name.suggestion.metrics;

import com.name.suggestion.diagnostic.DiagnosticCategory;

import java.time.Duration;

/**
 * Interface for recording suggestion metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordSuggestionDuration(DiagnosticCategory category, Duration duration);

    void recordSuggestionCount(DiagnosticCategory category, int count);

    void recordTopScore(double score);

    void incrementNoSuggestions(DiagnosticCategory category);

    void incrementPoolLoadFailure(DiagnosticCategory category);
}
