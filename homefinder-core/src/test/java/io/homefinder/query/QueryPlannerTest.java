package io.homefinder.query;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.core.IndexConfiguration.MismatchPolicy;
import io.homefinder.core.InvalidRangeException;
import io.homefinder.core.ResultMismatchException;
import io.homefinder.core.UnknownAttributeException;
import io.homefinder.index.AttributeRange;
import io.homefinder.index.IndexBuilder;
import io.homefinder.index.IndexEvaluation;
import io.homefinder.index.IndexPair;
import io.homefinder.index.IndexStatistics;
import io.homefinder.index.PropertyIndex;
import io.homefinder.logging.CapturingSlf4jServiceProvider;
import io.homefinder.storage.Property;
import io.homefinder.storage.PropertyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryPlannerTest {

    private final QueryPlanner planner = new QueryPlanner();

    @BeforeEach
    void clearLogs() {
        CapturingSlf4jServiceProvider.clear();
    }

    private static IndexPair bedrooms(int... counts) {
        var store = PropertyStore.builder();
        for (var count : counts) {
            store.add(Property.builder().bedrooms(count));
        }
        return IndexBuilder.buildIndexes(store.build(), IndexConfiguration.defaults());
    }

    @Test
    void exactMatchOnBedrooms() {
        var indexes = bedrooms(2, 3, 3, 4, 2);

        var result = planner.query(PropertyFilter.builder().equalTo("bedrooms", 3).build(), indexes);

        assertThat(result.ids()).containsExactly(1, 2);
        assertThat(result.totalMatches()).isEqualTo(2);
        assertThat(result.mismatch()).isFalse();
        assertThat(result.properties()).extracting(Property::id).containsExactly(1, 2);
        assertThat(result.hashSetElapsed()).isGreaterThanOrEqualTo(Duration.ZERO);
        assertThat(result.postingListElapsed()).isGreaterThanOrEqualTo(Duration.ZERO);
    }

    @Test
    void priceRangeIsExactDespiteBuckets() {
        var indexes = IndexBuilder.buildIndexes(PropertyStore.builder()
                .add(Property.builder().price(150_000))
                .add(Property.builder().price(250_000))
                .add(Property.builder().price(350_000))
                .build(), IndexConfiguration.defaults());

        var result = planner.query(PropertyFilter.builder().between("price", 200_000, 300_000).build(), indexes);

        assertThat(result.ids()).containsExactly(1);
    }

    @Test
    void disjointPredicatesYieldEmptyResultOnBothPaths() {
        var indexes = IndexBuilder.buildIndexes(PropertyStore.builder()
                .add(Property.builder().bedrooms(3).garage(false))
                .add(Property.builder().bedrooms(2).garage(true))
                .build(), IndexConfiguration.defaults());

        var result = planner.query(PropertyFilter.builder()
                .equalTo("bedrooms", 3)
                .equalTo("has_garage", true)
                .build(), indexes);

        assertThat(result.ids()).isEmpty();
        assertThat(result.properties()).isEmpty();
        assertThat(result.mismatch()).isFalse();
        assertThat(result.hashSetEvaluation().ids()).isEmpty();
        assertThat(result.postingListEvaluation().ids()).isEmpty();
    }

    @Test
    void emptyFilterReturnsEveryProperty() {
        var indexes = bedrooms(1, 2, 3, 4);

        var result = planner.query(PropertyFilter.all(), indexes);

        assertThat(result.ids()).containsExactly(0, 1, 2, 3);
        assertThat(result.hashSetEvaluation().lookups()).isZero();
    }

    @Test
    void absentValueShortCircuitsBothPaths() {
        var indexes = bedrooms(2, 3, 3, 4, 2);

        var result = planner.query(PropertyFilter.builder()
                .between("bedrooms", 2, 4)
                .equalTo("bathrooms", 7)
                .build(), indexes);

        assertThat(result.ids()).isEmpty();
        assertThat(result.hashSetEvaluation().setOperations()).isZero();
        assertThat(result.postingListEvaluation().setOperations()).isZero();
    }

    @Test
    void repeatedQueriesReturnTheSameAnswer() {
        var indexes = bedrooms(2, 3, 3, 4, 2, 5, 3);
        var filter = PropertyFilter.builder().atLeast("bedrooms", 3).build();

        var first = planner.query(filter, indexes);
        var second = planner.query(filter, indexes);

        assertThat(second.ids()).containsExactly(first.ids());
        assertThat(first.ids()).containsExactly(1, 2, 3, 5, 6);
    }

    @Test
    void limitCapsHydratedPropertiesOnly() {
        var indexes = bedrooms(3, 3, 3, 3, 3);

        var result = planner.query(PropertyFilter.builder().equalTo("bedrooms", 3).limit(2).build(), indexes);

        assertThat(result.totalMatches()).isEqualTo(5);
        assertThat(result.properties()).extracting(Property::id).containsExactly(0, 1);
    }

    @Test
    void emptyDatasetAnswersEveryQueryWithNothing() {
        var indexes = IndexBuilder.buildIndexes(List.of());

        assertThat(planner.query(PropertyFilter.all(), indexes).ids()).isEmpty();
        assertThat(planner.query(PropertyFilter.builder().equalTo("bedrooms", 1).build(), indexes).ids()).isEmpty();
    }

    @Test
    void validationFailsBeforeAnyIndexIsRead() {
        var indexes = bedrooms(1, 2);
        var hashSet = new CountingIndex(indexes.hashSetIndex());
        var postingList = new CountingIndex(indexes.postingListIndex());

        assertThatThrownBy(() -> planner.query(PropertyFilter.builder().equalTo("pool", true).build(), hashSet, postingList))
                .isInstanceOf(UnknownAttributeException.class);
        assertThatThrownBy(() -> planner.query(PropertyFilter.builder().between("bedrooms", 4, 1).build(), hashSet, postingList))
                .isInstanceOf(InvalidRangeException.class);

        assertThat(hashSet.evaluations.get()).isZero();
        assertThat(postingList.evaluations.get()).isZero();
    }

    @Test
    void mismatchFailsByDefaultAndIsLogged() {
        var indexes = bedrooms(2, 3, 3);
        var broken = new FixedIndex(indexes.store(), 1, 2, 0);
        var filter = PropertyFilter.builder().equalTo("bedrooms", 3).build();

        assertThatThrownBy(() -> planner.query(filter, broken, indexes.postingListIndex()))
                .isInstanceOfSatisfying(ResultMismatchException.class, e -> {
                    assertThat(e.onlyInHashSet()).containsExactly(0);
                    assertThat(e.onlyInPostingList()).isEmpty();
                });
        assertThat(CapturingSlf4jServiceProvider.events(QueryPlanner.class, Level.ERROR))
                .singleElement()
                .satisfies(event -> assertThat(event.message()).contains("disagree", "[0]"));
    }

    @Test
    void mismatchIsFlaggedWhenConfigured() {
        var indexes = bedrooms(2, 3, 3);
        var flagging = new QueryPlanner(IndexConfiguration.builder().mismatchPolicy(MismatchPolicy.FLAG).build());
        var broken = new FixedIndex(indexes.store(), 1);

        var result = flagging.query(PropertyFilter.builder().equalTo("bedrooms", 3).build(),
                broken, indexes.postingListIndex());

        assertThat(result.mismatch()).isTrue();
        assertThat(result.ids()).containsExactly(1, 2);
        assertThat(result.hashSetEvaluation().ids()).containsExactly(1);
        assertThat(result.toString()).contains("MISMATCH");
    }

    @Test
    void defaultPlannerFollowsPolicyIndexesWereBuiltWith() {
        var indexes = bedrooms(2, 3, 3);
        var flagConfig = IndexConfiguration.builder().mismatchPolicy(MismatchPolicy.FLAG).build();
        var broken = new FixedIndex(indexes.store(), flagConfig, 2);

        var result = planner.query(PropertyFilter.builder().equalTo("bedrooms", 3).build(),
                broken, indexes.postingListIndex());

        assertThat(result.mismatch()).isTrue();
        assertThat(result.ids()).containsExactly(1, 2);
    }

    @Test
    void explicitPlannerPolicyOverridesIndexConfiguration() {
        var indexes = bedrooms(2, 3, 3);
        var flagConfig = IndexConfiguration.builder().mismatchPolicy(MismatchPolicy.FLAG).build();
        var failing = new QueryPlanner(IndexConfiguration.builder().mismatchPolicy(MismatchPolicy.FAIL).build());
        var broken = new FixedIndex(indexes.store(), flagConfig, 2);

        assertThatThrownBy(() -> failing.query(PropertyFilter.builder().equalTo("bedrooms", 3).build(),
                broken, indexes.postingListIndex()))
                .isInstanceOf(ResultMismatchException.class);
    }

    @Test
    void defaultPlannerAcceptsPairBuiltWithFlagPolicy() {
        var flagConfig = IndexConfiguration.builder().mismatchPolicy(MismatchPolicy.FLAG).build();
        var store = PropertyStore.builder()
                .add(Property.builder().bedrooms(3))
                .add(Property.builder().bedrooms(1))
                .build();
        var indexes = IndexBuilder.buildIndexes(store, flagConfig);

        var result = planner.query(PropertyFilter.builder().equalTo("bedrooms", 3).build(), indexes);

        assertThat(result.mismatch()).isFalse();
        assertThat(result.ids()).containsExactly(0);
    }

    @Test
    void rejectsIndexesFromDifferentStores() {
        var a = bedrooms(1, 2);
        var b = bedrooms(1, 2);

        assertThatThrownBy(() -> planner.query(PropertyFilter.all(), a.hashSetIndex(), b.postingListIndex()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.query(PropertyFilter.all(), (IndexPair) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void differenceIgnoresOrderAndDuplicates() {
        assertThat(QueryPlanner.difference(new int[] {5, 1, 3, 3}, new int[] {3, 4})).containsExactly(1, 5);
        assertThat(QueryPlanner.difference(new int[] {}, new int[] {1})).isEmpty();
    }

    /**
     * Index that always answers with the same ids.
     */
    private static final class FixedIndex implements PropertyIndex {
        private final PropertyStore store;
        private final IndexConfiguration configuration;
        private final int[] ids;

        FixedIndex(PropertyStore store, int... ids) {
            this(store, IndexConfiguration.defaults(), ids);
        }

        FixedIndex(PropertyStore store, IndexConfiguration configuration, int... ids) {
            this.store = store;
            this.configuration = configuration;
            this.ids = ids;
        }

        @Override
        public String name() {
            return "fixed";
        }

        @Override
        public PropertyStore store() {
            return store;
        }

        @Override
        public IndexConfiguration configuration() {
            return configuration;
        }

        @Override
        public IndexEvaluation evaluate(List<AttributeRange> predicates) {
            return IndexEvaluation.of(ids, 1, 0);
        }

        @Override
        public IndexStatistics statistics() {
            return new IndexStatistics(name(), store.size(), 0, Map.of(), 0, 0d, 0L);
        }
    }

    private static final class CountingIndex implements PropertyIndex {
        private final PropertyIndex delegate;
        private final AtomicInteger evaluations = new AtomicInteger();

        CountingIndex(PropertyIndex delegate) {
            this.delegate = delegate;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public PropertyStore store() {
            return delegate.store();
        }

        @Override
        public IndexConfiguration configuration() {
            return delegate.configuration();
        }

        @Override
        public IndexEvaluation evaluate(List<AttributeRange> predicates) {
            evaluations.incrementAndGet();
            return delegate.evaluate(predicates);
        }

        @Override
        public IndexStatistics statistics() {
            return delegate.statistics();
        }
    }
}
