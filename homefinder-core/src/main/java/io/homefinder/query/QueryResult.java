package io.homefinder.query;

import io.homefinder.index.IndexEvaluation;
import io.homefinder.storage.Property;

import java.time.Duration;
import java.util.List;

/**
 * Answer to one {@link PropertyFilter}: the matching ids, the hydrated
 * properties and how long each index path took.
 * <p>
 * The elapsed times cover only each index's own evaluation, not validation,
 * hydration or the cross-check. When the planner runs with
 * {@code MismatchPolicy.FLAG} and the paths disagreed, {@link #mismatch()} is
 * true, {@link #ids()} holds the posting-list answer and both raw answers are
 * available through the evaluations.
 */
public final class QueryResult {
    private final int[] ids;
    private final List<Property> properties;
    private final Duration hashSetElapsed;
    private final Duration postingListElapsed;
    private final IndexEvaluation hashSetEvaluation;
    private final IndexEvaluation postingListEvaluation;
    private final boolean mismatch;

    QueryResult(int[] ids, List<Property> properties,
                Duration hashSetElapsed, Duration postingListElapsed,
                IndexEvaluation hashSetEvaluation, IndexEvaluation postingListEvaluation,
                boolean mismatch) {
        this.ids = ids;
        this.properties = properties;
        this.hashSetElapsed = hashSetElapsed;
        this.postingListElapsed = postingListElapsed;
        this.hashSetEvaluation = hashSetEvaluation;
        this.postingListEvaluation = postingListEvaluation;
        this.mismatch = mismatch;
    }

    /**
     * Matching property ids, ascending.
     */
    public int[] ids() {
        return ids.clone();
    }

    public int totalMatches() {
        return ids.length;
    }

    /**
     * Matching properties in id order, capped by the filter's limit.
     */
    public List<Property> properties() {
        return properties;
    }

    public Duration hashSetElapsed() {
        return hashSetElapsed;
    }

    public Duration postingListElapsed() {
        return postingListElapsed;
    }

    public IndexEvaluation hashSetEvaluation() {
        return hashSetEvaluation;
    }

    public IndexEvaluation postingListEvaluation() {
        return postingListEvaluation;
    }

    public boolean mismatch() {
        return mismatch;
    }

    @Override
    public String toString() {
        return "QueryResult{matches=" + ids.length
                + ", hashSet=" + hashSetElapsed.toNanos() / 1_000d + "us"
                + ", postingList=" + postingListElapsed.toNanos() / 1_000d + "us"
                + (mismatch ? ", MISMATCH" : "") + "}";
    }
}
