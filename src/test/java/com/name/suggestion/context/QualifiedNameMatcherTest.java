package com.name.suggestion.context;

import com.name.suggestion.ranking.ScoredName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualifiedNameMatcher Tests")
class QualifiedNameMatcherTest {

    private static final double EPSILON = 1e-4;

    private static final List<String> NAMESPACES = List.of(
            "System.Collections.Generic",
            "System.Collections",
            "System.Linq",
            "Microsoft.Extensions");

    private QualifiedNameMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new QualifiedNameMatcher();
    }

    @Test
    @DisplayName("Should find a misspelled namespace by whole name")
    void testWholeNameMatch() {
        List<ScoredName> result = matcher.findSimilar("System.Colections.Generic", NAMESPACES);

        assertFalse(result.isEmpty());
        assertEquals("System.Collections.Generic", result.get(0).name());
        assertTrue(result.stream().allMatch(r -> r.score() >= 0.7));
        assertTrue(result.stream().noneMatch(r -> r.name().equals("Microsoft.Extensions")));
    }

    @Test
    @DisplayName("Should fall back to segment matching when no whole name is close")
    void testSegmentFallback() {
        List<String> known = List.of("Alpha.Collections", "Beta.Streams", "Omega.Linq");

        List<ScoredName> result = matcher.findSimilar("Mm.Strams", known);

        assertEquals(1, result.size());
        assertEquals("Beta.Streams", result.get(0).name());
        // mean of the single matching segment
        assertEquals(0.9567, result.get(0).score(), EPSILON);
    }

    @Test
    @DisplayName("Segment matching should require at least half of the segments")
    void testSegmentRatio() {
        List<String> known = List.of("Alpha.Collections.Zed", "Beta.Streams.Qux");

        assertTrue(matcher.findSimilar("Xy.Colections.Wv", known).isEmpty());
    }

    @Test
    @DisplayName("Segment matching should only compare names with the same number of segments")
    void testSegmentCount() {
        List<String> known = List.of("Alpha.Collections.Zed", "Beta.Streams.Qux");

        assertTrue(matcher.findSimilar("Mm.Strams", known).isEmpty());
    }

    @Test
    @DisplayName("A trailing dot should count as an empty last segment")
    void testTrailingEmptySegment() {
        List<ScoredName> result = matcher.findSimilar("Qqq.", List.of("Zzz.", "Zzz"));

        assertEquals(1, result.size());
        assertEquals("Zzz.", result.get(0).name());
        // only the two empty segments match, and two empty names score 1.5
        assertEquals(1.5, result.get(0).score(), EPSILON);
    }

    @Test
    @DisplayName("Should return nothing for unrelated names")
    void testNoMatch() {
        assertTrue(matcher.findSimilar("Qqq.Www", NAMESPACES).isEmpty());
    }

    @Test
    @DisplayName("Should ignore duplicates, nulls and empty names")
    void testInvalidEntries() {
        List<ScoredName> result = matcher.findSimilar("Sytem.Linq",
                Arrays.asList("System.Linq", null, "", "System.Linq"));

        assertEquals(1, result.size());
        assertEquals("System.Linq", result.get(0).name());
    }

    @Test
    @DisplayName("Should return at most five names, best first")
    void testLimitAndOrder() {
        List<ScoredName> result = matcher.findSimilar("System.Colections",
                List.of("System.Collections", "System.Collection", "System.Collections.Generic",
                        "System.Collections.Concurrent", "System.Collections.Specialized",
                        "System.Collections.ObjectModel", "System.Collections.Immutable"));

        assertEquals(5, result.size());
        for (int i = 1; i < result.size(); i++) {
            assertTrue(result.get(i - 1).score() >= result.get(i).score());
        }
    }

    @Test
    @DisplayName("Should return empty list for null or empty input")
    void testEmptyInput() {
        assertTrue(matcher.findSimilar(null, NAMESPACES).isEmpty());
        assertTrue(matcher.findSimilar("", NAMESPACES).isEmpty());
        assertTrue(matcher.findSimilar("System", null).isEmpty());
    }
}
