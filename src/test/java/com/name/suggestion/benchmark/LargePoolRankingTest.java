package com.name.suggestion.benchmark;

import com.name.suggestion.ranking.Candidate;
import com.name.suggestion.ranking.CandidateRanker;
import com.name.suggestion.ranking.ScoredCandidate;
import com.name.suggestion.similarity.CompositeSimilarityScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ranking over pools the size of a large type's member list or a project's type index.
 *
 * These tests validate that ranking:
 * 1. Finds the same best candidate as a plain full scan (correctness)
 * 2. Stays within a generous time bound for a few thousand candidates
 */
class LargePoolRankingTest {

    private CandidateRanker ranker;
    private CompositeSimilarityScorer scorer;

    private static final String[] VERBS = {
            "get", "set", "find", "load", "save", "delete", "update", "create", "build", "parse",
            "read", "write", "open", "close", "reset", "compute", "resolve", "validate", "format", "render"
    };

    private static final String[] NOUNS = {
            "User", "Account", "Order", "Invoice", "Customer", "Address", "Payment", "Session", "Token", "Config",
            "Report", "Document", "Message", "Channel", "Request", "Response", "Handler", "Factory", "Cache", "Index"
    };

    @BeforeEach
    void setUp() {
        ranker = new CandidateRanker();
        scorer = new CompositeSimilarityScorer();
    }

    @Test
    void largePool_bestMatchEqualsFullScan() {
        List<Candidate<Integer>> pool = generatePool(4000);
        String unknown = "updteCustomerAdress";

        ScoredCandidate<Integer> fullScanBest = null;
        for (Candidate<Integer> candidate : pool) {
            double score = scorer.compute(unknown, candidate.name());
            if (fullScanBest == null || score > fullScanBest.score()) {
                fullScanBest = new ScoredCandidate<>(candidate.name(), candidate.value(), score);
            }
        }

        List<ScoredCandidate<Integer>> ranked = ranker.rankKeyed(unknown, pool);

        assertNotNull(fullScanBest);
        assertEquals(5, ranked.size());
        assertEquals(fullScanBest.name(), ranked.get(0).name());
        assertEquals(fullScanBest.score(), ranked.get(0).score());
        assertTrue(ranked.get(0).name().startsWith("updateCustomerAddress"),
                "Expected updateCustomerAddress*, got " + ranked.get(0).name());
    }

    @Test
    void largePool_completesWithinBound() {
        List<Candidate<Integer>> pool = generatePool(4000);
        List<String> queries = List.of("getUsr", "svaeOrder", "resolveTokn", "renderReprt", "buildFactroy");

        // warm-up
        for (String query : queries) {
            ranker.rankKeyed(query, pool);
        }

        long start = System.nanoTime();
        for (String query : queries) {
            assertFalse(ranker.rankKeyed(query, pool).isEmpty());
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 5_000, "Ranking 5 queries over 4000 candidates took " + elapsedMs + "ms");
    }

    @Test
    void largePool_flatAndKeyedAgree() {
        List<Candidate<Integer>> pool = generatePool(2000);
        List<String> names = new ArrayList<>();
        for (Candidate<Integer> candidate : pool) {
            names.add(candidate.name());
        }

        String unknown = "findInvioce";
        List<ScoredCandidate<Integer>> keyed = ranker.rankKeyed(unknown, pool);
        List<String> flat = ranker.rankFlat(unknown, names).stream().map(n -> n.name()).toList();

        assertEquals(keyed.stream().map(ScoredCandidate::name).toList(), flat);
    }

    private List<Candidate<Integer>> generatePool(int size) {
        List<Candidate<Integer>> pool = new ArrayList<>(size);
        int id = 0;
        outer:
        for (String verb : VERBS) {
            for (String noun : NOUNS) {
                for (String second : NOUNS) {
                    if (id >= size) {
                        break outer;
                    }
                    String name = noun.equals(second) ? verb + noun : verb + noun + second;
                    pool.add(Candidate.of(name, id++));
                }
            }
        }
        return pool;
    }
}
