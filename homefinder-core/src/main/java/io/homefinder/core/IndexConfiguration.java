package io.homefinder.core;

/**
 * Immutable configuration for building and querying the property indexes.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * IndexConfiguration config = IndexConfiguration.builder()
 *     .priceBucketWidth(25_000)
 *     .mergeStrategy(MergeStrategy.HEAP)
 *     .build();
 * </pre>
 * <p>
 * Bucket widths only affect how range predicates are decomposed into key
 * lookups; query results are exact regardless of the chosen widths.
 *
 * @see io.homefinder.index.IndexBuilder
 */
public final class IndexConfiguration {

    private static final IndexConfiguration DEFAULTS = builder().build();

    // Bucketing
    private final long priceBucketWidth;
    private final int yearBuiltBucketWidth;

    // Posting-list range unions
    private final MergeStrategy mergeStrategy;

    // Cross-check between the two index paths
    private final MismatchPolicy mismatchPolicy;

    // Build
    private final boolean parallelBuild;

    // Custom hash table sizing
    private final int hashTableInitialCapacity;
    private final double hashTableLoadFactor;

    private IndexConfiguration(Builder builder) {
        this.priceBucketWidth = builder.priceBucketWidth;
        this.yearBuiltBucketWidth = builder.yearBuiltBucketWidth;
        this.mergeStrategy = builder.mergeStrategy;
        this.mismatchPolicy = builder.mismatchPolicy;
        this.parallelBuild = builder.parallelBuild;
        this.hashTableInitialCapacity = builder.hashTableInitialCapacity;
        this.hashTableLoadFactor = builder.hashTableLoadFactor;
    }

    /**
     * Create a new builder for IndexConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every setting at its default.
     */
    public static IndexConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Width of one price bucket in currency units.
     *
     * @return price bucket width (default 50 000)
     */
    public long priceBucketWidth() {
        return priceBucketWidth;
    }

    /**
     * Width of one year-built bucket in years.
     *
     * @return year bucket width (default 10)
     */
    public int yearBuiltBucketWidth() {
        return yearBuiltBucketWidth;
    }

    /**
     * Strategy the posting-list index uses to union the lists of a range predicate.
     */
    public MergeStrategy mergeStrategy() {
        return mergeStrategy;
    }

    /**
     * What the query planner does when the two index paths disagree.
     */
    public MismatchPolicy mismatchPolicy() {
        return mismatchPolicy;
    }

    /**
     * Check if both indexes are built concurrently.
     *
     * @return true if the two builds run on separate threads
     */
    public boolean parallelBuild() {
        return parallelBuild;
    }

    public int hashTableInitialCapacity() {
        return hashTableInitialCapacity;
    }

    public double hashTableLoadFactor() {
        return hashTableLoadFactor;
    }

    @Override
    public String toString() {
        return "IndexConfiguration{priceBucketWidth=" + priceBucketWidth
                + ", yearBuiltBucketWidth=" + yearBuiltBucketWidth
                + ", mergeStrategy=" + mergeStrategy
                + ", mismatchPolicy=" + mismatchPolicy
                + ", parallelBuild=" + parallelBuild
                + ", hashTableInitialCapacity=" + hashTableInitialCapacity
                + ", hashTableLoadFactor=" + hashTableLoadFactor + "}";
    }

    /**
     * How a range predicate's posting lists are unioned into one list.
     */
    public enum MergeStrategy {
        /**
         * Fold the lists left to right with a linear two-way merge.
         */
        PAIRWISE,

        /**
         * Merge all lists at once through a min-heap of list cursors.
         */
        HEAP
    }

    /**
     * Reaction to a disagreement between the hash-set and posting-list results.
     */
    public enum MismatchPolicy {
        /**
         * Throw {@link ResultMismatchException}.
         */
        FAIL,

        /**
         * Return the result marked as mismatched, with both id sets attached.
         */
        FLAG
    }

    /**
     * Builder for IndexConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private long priceBucketWidth = 50_000L;
        private int yearBuiltBucketWidth = 10;
        private MergeStrategy mergeStrategy = MergeStrategy.PAIRWISE;
        private MismatchPolicy mismatchPolicy = MismatchPolicy.FAIL;
        private boolean parallelBuild;
        private int hashTableInitialCapacity = 16;
        private double hashTableLoadFactor = 0.75d;

        private Builder() {
        }

        /**
         * Set the price bucket width.
         *
         * @param priceBucketWidth width in currency units, must be positive
         * @return this builder for method chaining
         */
        public Builder priceBucketWidth(long priceBucketWidth) {
            this.priceBucketWidth = priceBucketWidth;
            return this;
        }

        /**
         * Set the year-built bucket width.
         *
         * @param yearBuiltBucketWidth width in years, must be positive
         * @return this builder for method chaining
         */
        public Builder yearBuiltBucketWidth(int yearBuiltBucketWidth) {
            this.yearBuiltBucketWidth = yearBuiltBucketWidth;
            return this;
        }

        public Builder mergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        public Builder mismatchPolicy(MismatchPolicy mismatchPolicy) {
            this.mismatchPolicy = mismatchPolicy;
            return this;
        }

        /**
         * Enable or disable building both indexes concurrently.
         *
         * @param parallelBuild true to build on two worker threads
         * @return this builder for method chaining
         */
        public Builder parallelBuild(boolean parallelBuild) {
            this.parallelBuild = parallelBuild;
            return this;
        }

        public Builder hashTableInitialCapacity(int hashTableInitialCapacity) {
            this.hashTableInitialCapacity = hashTableInitialCapacity;
            return this;
        }

        public Builder hashTableLoadFactor(double hashTableLoadFactor) {
            this.hashTableLoadFactor = hashTableLoadFactor;
            return this;
        }

        /**
         * Build the immutable IndexConfiguration.
         *
         * @return a new IndexConfiguration instance
         * @throws IllegalArgumentException if a setting is out of range
         */
        public IndexConfiguration build() {
            if (priceBucketWidth <= 0) {
                throw new IllegalArgumentException("priceBucketWidth must be positive: " + priceBucketWidth);
            }
            if (yearBuiltBucketWidth <= 0) {
                throw new IllegalArgumentException("yearBuiltBucketWidth must be positive: " + yearBuiltBucketWidth);
            }
            if (mergeStrategy == null) {
                throw new IllegalArgumentException("mergeStrategy required");
            }
            if (mismatchPolicy == null) {
                throw new IllegalArgumentException("mismatchPolicy required");
            }
            if (hashTableInitialCapacity <= 0) {
                throw new IllegalArgumentException("hashTableInitialCapacity must be positive: " + hashTableInitialCapacity);
            }
            if (!(hashTableLoadFactor > 0d && hashTableLoadFactor < 1d)) {
                throw new IllegalArgumentException("hashTableLoadFactor must be in (0, 1): " + hashTableLoadFactor);
            }
            return new IndexConfiguration(this);
        }
    }
}
