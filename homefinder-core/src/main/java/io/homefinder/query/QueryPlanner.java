package io.homefinder.query;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.core.IndexConfiguration.MismatchPolicy;
import io.homefinder.core.ResultMismatchException;
import io.homefinder.index.AttributeRange;
import io.homefinder.index.IndexEvaluation;
import io.homefinder.index.IndexPair;
import io.homefinder.index.PropertyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Evaluates a filter against both indexes and cross-checks the answers.
 * <p>
 * <b>Steps:</b>
 * <ol>
 *   <li>Resolve the filter; unknown attributes and bad ranges fail here,
 *       before either index is read.</li>
 *   <li>Evaluate on the hash-set index, then on the posting-list index, timing
 *       each evaluation on its own.</li>
 *   <li>Compare the two id lists. Disagreement is an index defect and is
 *       handled per {@link MismatchPolicy}.</li>
 *   <li>Hydrate the matching properties.</li>
 * </ol>
 * <b>Mismatch policy:</b> a planner created with an explicit
 * {@link IndexConfiguration} always applies that configuration's policy.
 * A planner created with {@link #QueryPlanner()} applies the policy the
 * indexes were built with: {@link IndexPair#configuration()}, or the
 * hash-set index's configuration when the two indexes are passed separately.
 * <p>
 * Stateless apart from its configuration; one planner may serve any number
 * of concurrent queries.
 */
public final class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private final PredicateResolver resolver = new PredicateResolver();
    // null: follow the configuration the indexes were built with
    private final MismatchPolicy mismatchPolicy;

    public QueryPlanner() {
        this.mismatchPolicy = null;
    }

    public QueryPlanner(IndexConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.mismatchPolicy = configuration.mismatchPolicy();
    }

    public QueryResult query(PropertyFilter filter, IndexPair indexes) {
        if (indexes == null) {
            throw new IllegalArgumentException("indexes required");
        }
        return query(filter, indexes.hashSetIndex(), indexes.postingListIndex(),
                policyFor(indexes.configuration()));
    }

    /**
     * @throws io.homefinder.core.UnknownAttributeException if the filter names a non-indexed attribute
     * @throws io.homefinder.core.InvalidRangeException     if a value or range is malformed
     * @throws ResultMismatchException                     if the paths disagree under {@link MismatchPolicy#FAIL}
     */
    public QueryResult query(PropertyFilter filter, PropertyIndex hashSetIndex, PropertyIndex postingListIndex) {
        if (hashSetIndex == null || postingListIndex == null) {
            throw new IllegalArgumentException("both indexes required");
        }
        return query(filter, hashSetIndex, postingListIndex, policyFor(hashSetIndex.configuration()));
    }

    private QueryResult query(PropertyFilter filter, PropertyIndex hashSetIndex, PropertyIndex postingListIndex,
                              MismatchPolicy policy) {
        if (hashSetIndex.store() != postingListIndex.store()) {
            throw new IllegalArgumentException("indexes were built from different stores");
        }
        List<AttributeRange> predicates = resolver.resolve(filter);

        var start = System.nanoTime();
        IndexEvaluation hashSet = hashSetIndex.evaluate(predicates);
        var hashSetElapsed = Duration.ofNanos(System.nanoTime() - start);

        start = System.nanoTime();
        IndexEvaluation postingList = postingListIndex.evaluate(predicates);
        var postingListElapsed = Duration.ofNanos(System.nanoTime() - start);

        var hashSetIds = hashSet.ids();
        var postingListIds = postingList.ids();
        var mismatch = !Arrays.equals(hashSetIds, postingListIds);
        if (mismatch) {
            var onlyInHashSet = difference(hashSetIds, postingListIds);
            var onlyInPostingList = difference(postingListIds, hashSetIds);
            log.error("Index paths disagree for {}: only in {}={}, only in {}={}",
                    filter, hashSetIndex.name(), Arrays.toString(onlyInHashSet),
                    postingListIndex.name(), Arrays.toString(onlyInPostingList));
            if (policy == MismatchPolicy.FAIL) {
                throw new ResultMismatchException(String.valueOf(filter), onlyInHashSet, onlyInPostingList);
            }
        }

        var limit = filter.limit().orElse(Integer.MAX_VALUE);
        var properties = postingListIndex.store().hydrate(postingListIds, limit);
        if (log.isDebugEnabled()) {
            log.debug("{} matched {} properties: {}={}us ({} lookups, {} set ops), {}={}us ({} lookups, {} set ops)",
                    filter, postingListIds.length,
                    hashSetIndex.name(), hashSetElapsed.toNanos() / 1_000, hashSet.lookups(), hashSet.setOperations(),
                    postingListIndex.name(), postingListElapsed.toNanos() / 1_000,
                    postingList.lookups(), postingList.setOperations());
        }
        return new QueryResult(postingListIds, properties, hashSetElapsed, postingListElapsed,
                hashSet, postingList, mismatch);
    }

    private MismatchPolicy policyFor(IndexConfiguration indexConfiguration) {
        if (mismatchPolicy != null) {
            return mismatchPolicy;
        }
        return indexConfiguration == null ? MismatchPolicy.FAIL : indexConfiguration.mismatchPolicy();
    }

    /**
     * Ids in {@code left} but not in {@code right}. Inputs need not be sorted.
     */
    static int[] difference(int[] left, int[] right) {
        var a = left.clone();
        var b = right.clone();
        Arrays.sort(a);
        Arrays.sort(b);
        var out = new int[a.length];
        var n = 0;
        var j = 0;
        for (var i = 0; i < a.length; i++) {
            if (i > 0 && a[i] == a[i - 1]) {
                continue;
            }
            while (j < b.length && b[j] < a[i]) {
                j++;
            }
            if (j == b.length || b[j] != a[i]) {
                out[n++] = a[i];
            }
        }
        return Arrays.copyOf(out, n);
    }
}
