package io.homefinder.index;

import io.homefinder.core.HomefinderException;
import io.homefinder.core.IndexConfiguration;
import io.homefinder.storage.Property;
import io.homefinder.storage.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One-time construction of the hash-set and posting-list indexes.
 * <p>
 * With {@link IndexConfiguration#parallelBuild()} the two indexes are built on
 * two worker threads; the call still returns only when both are complete.
 */
public final class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private IndexBuilder() {
    }

    public static IndexPair buildIndexes(List<Property> properties) {
        return buildIndexes(properties, IndexConfiguration.defaults());
    }

    public static IndexPair buildIndexes(List<Property> properties, IndexConfiguration configuration) {
        return buildIndexes(PropertyStore.of(properties), configuration);
    }

    public static IndexPair buildIndexes(PropertyStore store, IndexConfiguration configuration) {
        if (store == null || configuration == null) {
            throw new IllegalArgumentException("store and configuration required");
        }
        if (store.isEmpty()) {
            log.warn("Building indexes over an empty dataset, every query will return no results");
        }
        log.info("Building indexes for {} properties with {}", store.size(), configuration);

        HashSetIndex hashSetIndex;
        PostingListIndex postingListIndex;
        if (configuration.parallelBuild()) {
            ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
                var thread = new Thread(runnable, "homefinder-index-build");
                thread.setDaemon(true);
                return thread;
            });
            try {
                var hashSet = CompletableFuture.supplyAsync(() -> HashSetIndex.build(store, configuration), executor);
                var postingList = CompletableFuture.supplyAsync(() -> PostingListIndex.build(store, configuration), executor);
                hashSetIndex = hashSet.join();
                postingListIndex = postingList.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new HomefinderException("Index build failed", e.getCause());
            } finally {
                executor.shutdown();
            }
        } else {
            hashSetIndex = HashSetIndex.build(store, configuration);
            postingListIndex = PostingListIndex.build(store, configuration);
        }

        logBuilt(hashSetIndex.statistics());
        logBuilt(postingListIndex.statistics());
        return new IndexPair(store, hashSetIndex, postingListIndex, configuration);
    }

    private static void logBuilt(IndexStatistics statistics) {
        log.info("Built {} index: {} properties, {} posting keys in {} ms",
                statistics.index(), statistics.properties(), statistics.postingKeys(), statistics.buildMillis());
    }
}
