package com.name.suggestion.ranking;

import com.name.suggestion.similarity.CompositeSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects and orders the best matches for an unknown name from a candidate pool.
 *
 * <p>Invalid entries (null or empty names) are discarded, every remaining entry is scored
 * with the {@link CompositeSimilarityScorer}, and the results are sorted by descending score
 * (ties keep input order) and truncated to {@link RankingOptions#getMaxResults()}.
 * The ranker holds no mutable state and is safe to share between threads.</p>
 */
public class CandidateRanker {
    private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

    private final CompositeSimilarityScorer scorer;
    private final RankingOptions options;

    public CandidateRanker() {
        this(new CompositeSimilarityScorer(), RankingOptions.defaults());
    }

    public CandidateRanker(RankingOptions options) {
        this(new CompositeSimilarityScorer(), options);
    }

    public CandidateRanker(CompositeSimilarityScorer scorer, RankingOptions options) {
        this.scorer = scorer;
        this.options = options;
    }

    /**
     * Ranks keyed candidates. Candidates whose name equals the unknown name exactly are excluded.
     *
     * @param unknown    the unresolved name
     * @param candidates candidate pool, may be null or contain invalid entries
     * @param <T>        payload type, passed through untouched
     * @return at most {@code maxResults} scored candidates, best first; never null
     */
    public <T> List<ScoredCandidate<T>> rankKeyed(String unknown, Iterable<Candidate<T>> candidates) {
        if (unknown == null || unknown.isEmpty() || candidates == null) {
            return List.of();
        }

        List<ScoredCandidate<T>> scored = new ArrayList<>();
        int considered = 0;
        for (Candidate<T> candidate : candidates) {
            if (candidate == null || !candidate.isValid() || candidate.name().equals(unknown)) {
                continue;
            }
            considered++;
            double score = scorer.compute(unknown, candidate.name());
            if (score >= options.getMinimumScore()) {
                scored.add(new ScoredCandidate<>(candidate.name(), candidate.value(), score));
            }
        }

        scored.sort(Comparator.comparingDouble((ScoredCandidate<T> c) -> c.score()).reversed());
        List<ScoredCandidate<T>> top = truncate(scored);
        log.debug("Ranked {} of {} candidates for '{}', returning {}", scored.size(), considered, unknown, top.size());
        return top;
    }

    /**
     * Ranks plain candidate names.
     *
     * @param unknown    the unresolved name
     * @param candidates candidate names, may be null or contain null/empty entries
     * @return at most {@code maxResults} scored names, best first; never null
     */
    public List<ScoredName> rankFlat(String unknown, Iterable<String> candidates) {
        if (unknown == null || unknown.isEmpty() || candidates == null) {
            return List.of();
        }

        List<ScoredName> scored = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            double score = scorer.compute(unknown, candidate);
            if (score >= options.getMinimumScore()) {
                scored.add(new ScoredName(candidate, score));
            }
        }

        scored.sort(Comparator.comparingDouble(ScoredName::score).reversed());
        List<ScoredName> top = truncate(scored);
        log.debug("Ranked {} names for '{}', returning {}", scored.size(), unknown, top.size());
        return top;
    }

    public RankingOptions getOptions() {
        return options;
    }

    public CompositeSimilarityScorer getScorer() {
        return scorer;
    }

    private <R> List<R> truncate(List<R> sorted) {
        if (sorted.size() <= options.getMaxResults()) {
            return List.copyOf(sorted);
        }
        return List.copyOf(sorted.subList(0, options.getMaxResults()));
    }
}
