package com.name.suggestion.benchmark;

import com.name.suggestion.ranking.Candidate;
import com.name.suggestion.ranking.CandidateRanker;
import com.name.suggestion.similarity.CompositeSimilarityScorer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for composite scoring and top-5 ranking at different pool sizes.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class RankingBenchmark {

    @Param({"100", "1000", "10000"})
    private int poolSize;

    private List<Candidate<Integer>> pool;
    private CandidateRanker ranker;
    private CompositeSimilarityScorer scorer;
    private int queryCounter;

    @Setup(Level.Trial)
    public void setUp() {
        ranker = new CandidateRanker();
        scorer = new CompositeSimilarityScorer();
        pool = new ArrayList<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            pool.add(Candidate.of("member" + i + "Value", i));
        }
    }

    @Benchmark
    public void rankKeyed(Blackhole bh) {
        int idx = queryCounter++ % poolSize;
        bh.consume(ranker.rankKeyed("membr" + idx + "Valu", pool));
    }

    @Benchmark
    public void compositeScore(Blackhole bh) {
        int idx = queryCounter++ % poolSize;
        bh.consume(scorer.compute("membr" + idx + "Valu", pool.get(idx).name()));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(RankingBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
