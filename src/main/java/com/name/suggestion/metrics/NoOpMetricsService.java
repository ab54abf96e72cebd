package com.name.suggestion.metrics;

import com.name.suggestion.diagnostic.DiagnosticCategory;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSuggestionDuration(DiagnosticCategory category, Duration duration) {
    }

    @Override
    public void recordSuggestionCount(DiagnosticCategory category, int count) {
    }

    @Override
    public void recordTopScore(double score) {
    }

    @Override
    public void incrementNoSuggestions(DiagnosticCategory category) {
    }

    @Override
    public void incrementPoolLoadFailure(DiagnosticCategory category) {
    }
}
