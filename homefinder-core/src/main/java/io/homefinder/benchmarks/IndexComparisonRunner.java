package io.homefinder.benchmarks;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.index.IndexBuilder;
import io.homefinder.query.PropertyFilter;
import io.homefinder.query.QueryPlanner;

import java.time.Duration;
import java.util.List;

/**
 * Console comparison of the two index paths on synthetic data.
 * Usage: {@code IndexComparisonRunner [propertyCount] [HEAP|PAIRWISE]}
 */
public class IndexComparisonRunner {
    private static final int ROUNDS = 200;

    public static void main(String[] args) {
        var count = args.length > 0 ? Integer.parseInt(args[0]) : 200_000;
        var strategy = args.length > 1
                ? IndexConfiguration.MergeStrategy.valueOf(args[1])
                : IndexConfiguration.MergeStrategy.PAIRWISE;
        var configuration = IndexConfiguration.builder().mergeStrategy(strategy).build();

        System.out.println("\n=== Index comparison: " + count + " properties, " + strategy + " merge ===");
        var indexes = IndexBuilder.buildIndexes(SyntheticProperties.generate(count, 42L), configuration);
        System.out.println(indexes.hashSetIndex().statistics());
        System.out.println(indexes.postingListIndex().statistics());

        var planner = new QueryPlanner(configuration);
        var filters = List.of(
                PropertyFilter.builder().equalTo("bedrooms", 4).atLeast("bathrooms", 3).between("price", 300_000, 400_000).build(),
                PropertyFilter.builder().equalTo("bedrooms", 3).between("price", 200_000, 400_000).require("garage").build(),
                PropertyFilter.builder().between("year_built", 1990, 2009).require("fireplace").require("basement").build(),
                PropertyFilter.builder().atMost("price", 150_000).build(),
                PropertyFilter.builder().equalTo("bedrooms", 42).build());

        for (var filter : filters) {
            // warm-up
            for (var i = 0; i < ROUNDS / 4; i++) {
                planner.query(filter, indexes);
            }
            var hashSet = Duration.ZERO;
            var postingList = Duration.ZERO;
            var matches = 0;
            for (var i = 0; i < ROUNDS; i++) {
                var result = planner.query(filter, indexes);
                hashSet = hashSet.plus(result.hashSetElapsed());
                postingList = postingList.plus(result.postingListElapsed());
                matches = result.totalMatches();
            }
            System.out.printf("%-110s matches=%7d  hash-set=%8.1fus  posting-list=%8.1fus%n",
                    filter, matches,
                    hashSet.toNanos() / 1_000d / ROUNDS,
                    postingList.toNanos() / 1_000d / ROUNDS);
        }
    }
}
