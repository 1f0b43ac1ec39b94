package io.homefinder.benchmarks;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.index.AttributeRange;
import io.homefinder.index.IndexBuilder;
import io.homefinder.index.IndexPair;
import io.homefinder.query.PredicateResolver;
import io.homefinder.query.PropertyFilter;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class IndexComparisonBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"100000"})
        public int properties;

        @Param({"PAIRWISE", "HEAP"})
        public IndexConfiguration.MergeStrategy mergeStrategy;

        private IndexPair indexes;
        private List<AttributeRange> selective;
        private List<AttributeRange> wideRange;

        @Setup(Level.Trial)
        public void setUp() {
            var configuration = IndexConfiguration.builder().mergeStrategy(mergeStrategy).build();
            indexes = IndexBuilder.buildIndexes(SyntheticProperties.generate(properties, 7L), configuration);
            var resolver = new PredicateResolver();
            selective = resolver.resolve(PropertyFilter.builder()
                    .equalTo("bedrooms", 3)
                    .between("price", 200_000, 400_000)
                    .require("garage")
                    .build());
            wideRange = resolver.resolve(PropertyFilter.builder()
                    .atMost("price", 900_000)
                    .between("year_built", 1900, 2010)
                    .build());
        }
    }

    @Benchmark
    public int hashSetSelective(BenchmarkState state) {
        return state.indexes.hashSetIndex().evaluate(state.selective).size();
    }

    @Benchmark
    public int postingListSelective(BenchmarkState state) {
        return state.indexes.postingListIndex().evaluate(state.selective).size();
    }

    @Benchmark
    public int hashSetWideRange(BenchmarkState state) {
        return state.indexes.hashSetIndex().evaluate(state.wideRange).size();
    }

    @Benchmark
    public int postingListWideRange(BenchmarkState state) {
        return state.indexes.postingListIndex().evaluate(state.wideRange).size();
    }
}
