package com.name.suggestion.metrics;

import com.name.suggestion.diagnostic.DiagnosticCategory;
import com.name.suggestion.diagnostic.PayloadFormatter;
import com.name.suggestion.diagnostic.SuggestionService;
import com.name.suggestion.ranking.Candidate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordSuggestionDuration(DiagnosticCategory.MEMBER_NOT_FOUND, Duration.ofMillis(3));
                noOp.recordSuggestionCount(DiagnosticCategory.MEMBER_NOT_FOUND, 5);
                noOp.recordTopScore(1.2);
                noOp.incrementNoSuggestions(DiagnosticCategory.VARIABLE_NOT_FOUND);
                noOp.incrementPoolLoadFailure(DiagnosticCategory.NAMESPACE_NOT_FOUND);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record suggestion duration as timer")
        void recordSuggestionDuration() {
            metrics.recordSuggestionDuration(DiagnosticCategory.MEMBER_NOT_FOUND, Duration.ofMillis(2));
            metrics.recordSuggestionDuration(DiagnosticCategory.MEMBER_NOT_FOUND, Duration.ofMillis(4));

            Timer timer = registry.find("suggestion.duration")
                    .tag("category", "MEMBER_NOT_FOUND")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should record suggestion count per category")
        void recordSuggestionCount() {
            metrics.recordSuggestionCount(DiagnosticCategory.MEMBER_NOT_FOUND, 3);
            metrics.recordSuggestionCount(DiagnosticCategory.MEMBER_NOT_FOUND, 5);
            metrics.recordSuggestionCount(DiagnosticCategory.VARIABLE_NOT_FOUND, 1);

            DistributionSummary member = registry.find("suggestion.count")
                    .tag("category", "MEMBER_NOT_FOUND")
                    .summary();
            DistributionSummary variable = registry.find("suggestion.count")
                    .tag("category", "VARIABLE_NOT_FOUND")
                    .summary();

            assertNotNull(member);
            assertEquals(2, member.count());
            assertEquals(8.0, member.totalAmount());
            assertNotNull(variable);
            assertEquals(1, variable.count());
        }

        @Test
        @DisplayName("Should record top score distribution")
        void recordTopScore() {
            metrics.recordTopScore(1.2);
            metrics.recordTopScore(0.8);

            DistributionSummary summary = registry.find("suggestion.top.score").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.2, summary.max(), 1e-9);
        }

        @Test
        @DisplayName("Should count lookups without suggestions")
        void incrementNoSuggestions() {
            metrics.incrementNoSuggestions(DiagnosticCategory.NAMESPACE_NOT_FOUND);
            metrics.incrementNoSuggestions(DiagnosticCategory.NAMESPACE_NOT_FOUND);

            Counter counter = registry.find("suggestion.none")
                    .tag("category", "NAMESPACE_NOT_FOUND")
                    .counter();

            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }

        @Test
        @DisplayName("Should count pool load failures")
        void incrementPoolLoadFailure() {
            metrics.incrementPoolLoadFailure(DiagnosticCategory.MEMBER_NOT_FOUND);

            Counter counter = registry.find("suggestion.pool.failure")
                    .tag("category", "MEMBER_NOT_FOUND")
                    .counter();

            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should record metrics through the suggestion service")
        void recordThroughService() {
            SuggestionService service = new SuggestionService(metrics);

            service.suggest(DiagnosticCategory.MEMBER_NOT_FOUND, "frstName", "Person",
                    List.of(Candidate.ofName("firstName")), PayloadFormatter.names());
            service.suggest(DiagnosticCategory.MEMBER_NOT_FOUND, "frstName", "Person",
                    List.<Candidate<String>>of(), PayloadFormatter.names());

            Timer timer = registry.find("suggestion.duration").tag("category", "MEMBER_NOT_FOUND").timer();
            Counter none = registry.find("suggestion.none").tag("category", "MEMBER_NOT_FOUND").counter();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertNotNull(none);
            assertEquals(1.0, none.count());
            assertEquals(1, registry.find("suggestion.top.score").summary().count());
        }
    }
}
