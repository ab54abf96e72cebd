package com.name.suggestion.context;

import com.name.suggestion.ranking.ScoredName;
import com.name.suggestion.similarity.CompositeSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds dotted names (namespaces, packages) similar to an unknown dotted name.
 *
 * <p>Whole names are compared first with a strict threshold. Only when nothing passes,
 * and the query has more than one segment, candidates with the same number of segments
 * are compared segment by segment: a candidate qualifies when at least half of its segments
 * match, and is scored by the mean score of its matching segments. Empty segments count,
 * so {@code "System."} has two segments, the second one empty.</p>
 */
public class QualifiedNameMatcher {
    private static final Logger log = LoggerFactory.getLogger(QualifiedNameMatcher.class);

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\.");

    private static final double WHOLE_NAME_THRESHOLD = 0.7;
    private static final double SEGMENT_THRESHOLD = 0.6;
    private static final double MIN_MATCHING_SEGMENT_RATIO = 0.5;
    private static final int MAX_RESULTS = 5;

    private final CompositeSimilarityScorer scorer;

    public QualifiedNameMatcher() {
        this(new CompositeSimilarityScorer());
    }

    public QualifiedNameMatcher(CompositeSimilarityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Finds qualified names similar to the unknown one.
     *
     * @param unknown    the unresolved dotted name
     * @param candidates known dotted names; duplicates and null/empty entries are ignored
     * @return at most 5 names, best first; never null
     */
    public List<ScoredName> findSimilar(String unknown, Iterable<String> candidates) {
        if (unknown == null || unknown.isEmpty() || candidates == null) {
            return List.of();
        }

        Set<String> distinct = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                distinct.add(candidate);
            }
        }

        List<ScoredName> result = new ArrayList<>();
        for (String candidate : distinct) {
            double score = scorer.compute(unknown, candidate);
            if (score >= WHOLE_NAME_THRESHOLD) {
                result.add(new ScoredName(candidate, score));
            }
        }

        String[] unknownSegments = SEGMENT_SEPARATOR.split(unknown, -1);
        if (result.isEmpty() && unknownSegments.length > 1) {
            log.debug("No whole-name match for '{}', comparing {} segments", unknown, unknownSegments.length);
            for (String candidate : distinct) {
                String[] candidateSegments = SEGMENT_SEPARATOR.split(candidate, -1);
                if (candidateSegments.length == unknownSegments.length) {
                    matchSegments(unknownSegments, candidateSegments)
                            .ifPresent(score -> result.add(new ScoredName(candidate, score)));
                }
            }
        }

        result.sort(Comparator.comparingDouble(ScoredName::score).reversed());
        return result.size() > MAX_RESULTS ? List.copyOf(result.subList(0, MAX_RESULTS)) : List.copyOf(result);
    }

    private OptionalDouble matchSegments(String[] unknownSegments, String[] candidateSegments) {
        double total = 0;
        int matched = 0;
        for (int i = 0; i < unknownSegments.length; i++) {
            double segmentScore = scorer.compute(unknownSegments[i], candidateSegments[i]);
            if (segmentScore >= SEGMENT_THRESHOLD) {
                total += segmentScore;
                matched++;
            }
        }

        if (matched > 0 && (double) matched / unknownSegments.length >= MIN_MATCHING_SEGMENT_RATIO) {
            return OptionalDouble.of(total / matched);
        }
        return OptionalDouble.empty();
    }
}
