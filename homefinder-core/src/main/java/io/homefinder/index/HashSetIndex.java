package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.kernel.HashIdSet;
import io.homefinder.kernel.HashTable;
import io.homefinder.kernel.IdSet;
import io.homefinder.kernel.IdSets;
import io.homefinder.storage.PropertyStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * Inverted index whose containers are unordered hash sets.
 * <p>
 * <b>Layout:</b> {@code HashTable<Attribute, HashTable<Long, HashIdSet>>}, both
 * levels on the custom {@link HashTable}.
 * <p>
 * <b>Query:</b> each range predicate's bucket sets are unioned into one set,
 * then the per-predicate sets are intersected smallest first, checking the
 * larger set for every id of the running result. The final ids are sorted
 * before returning.
 */
public final class HashSetIndex implements PropertyIndex {
    public static final String NAME = "hash-set";

    private final PropertyStore store;
    private final IndexConfiguration configuration;
    private final HashTable<Attribute, HashTable<Long, HashIdSet>> postings;
    private final long[] minKeys;
    private final long[] maxKeys;
    private final long buildMillis;

    private HashSetIndex(PropertyStore store, IndexConfiguration configuration,
                         HashTable<Attribute, HashTable<Long, HashIdSet>> postings,
                         long[] minKeys, long[] maxKeys, long buildMillis) {
        this.store = store;
        this.configuration = configuration;
        this.postings = postings;
        this.minKeys = minKeys;
        this.maxKeys = maxKeys;
        this.buildMillis = buildMillis;
    }

    /**
     * Indexes every attribute of every property in one pass over the store.
     */
    public static HashSetIndex build(PropertyStore store, IndexConfiguration configuration) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(configuration, "configuration");
        var start = System.nanoTime();
        var capacity = configuration.hashTableInitialCapacity();
        var loadFactor = configuration.hashTableLoadFactor();
        var attributes = Attribute.values();
        var postings = new HashTable<Attribute, HashTable<Long, HashIdSet>>(attributes.length * 2, loadFactor);
        var minKeys = new long[attributes.length];
        var maxKeys = new long[attributes.length];
        Arrays.fill(minKeys, Long.MAX_VALUE);
        Arrays.fill(maxKeys, Long.MIN_VALUE);

        for (var property : store) {
            for (var attribute : attributes) {
                var key = attribute.keyOf(property, configuration);
                var byKey = postings.computeIfAbsent(attribute, ignored -> new HashTable<>(capacity, loadFactor));
                byKey.computeIfAbsent(key, ignored -> HashIdSet.withCapacity(capacity, loadFactor)).add(property.id());
                var ordinal = attribute.ordinal();
                minKeys[ordinal] = Math.min(minKeys[ordinal], key);
                maxKeys[ordinal] = Math.max(maxKeys[ordinal], key);
            }
        }
        var buildMillis = (System.nanoTime() - start) / 1_000_000L;
        return new HashSetIndex(store, configuration, postings, minKeys, maxKeys, buildMillis);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PropertyStore store() {
        return store;
    }

    @Override
    public IndexConfiguration configuration() {
        return configuration;
    }

    /**
     * Set stored under the attribute's key, or an empty set.
     */
    public IdSet lookup(Attribute attribute, long key) {
        var byKey = postings.getOrDefault(attribute, null);
        if (byKey == null) {
            return IdSets.empty();
        }
        IdSet set = byKey.getOrDefault(key, null);
        return set == null ? IdSets.empty() : set;
    }

    @Override
    public IndexEvaluation evaluate(List<AttributeRange> predicates) {
        if (predicates.isEmpty()) {
            return new IndexEvaluation(IdSets.allIds(store.size()), 0, 0);
        }
        var lookups = 0;
        var perPredicate = new ArrayList<List<HashIdSet>>(predicates.size());
        for (var predicate : predicates) {
            var containers = containersFor(predicate);
            if (containers.isEmpty()) {
                return IndexEvaluation.empty(lookups);
            }
            lookups += containers.size();
            perPredicate.add(containers);
        }

        var operations = 0;
        var sets = new ArrayList<IdSet>(perPredicate.size());
        for (var containers : perPredicate) {
            if (containers.size() == 1) {
                sets.add(containers.get(0));
                continue;
            }
            var expected = 0;
            for (var container : containers) {
                expected += container.size();
            }
            var union = new HashIdSet(expected, configuration.hashTableLoadFactor());
            for (var container : containers) {
                union.addAll(container);
            }
            operations += containers.size() - 1;
            sets.add(union);
        }

        sets.sort(Comparator.comparingInt(IdSet::size));
        var order = new int[sets.size()];
        var result = sets.get(0);
        order[0] = result.size();
        var consumed = 1;
        for (var i = 1; i < sets.size() && !result.isEmpty(); i++) {
            order[consumed++] = sets.get(i).size();
            result = intersect(result, sets.get(i));
            operations++;
        }
        return new IndexEvaluation(refineAndSort(result, predicates), lookups, operations,
                consumed > 1 ? Arrays.copyOf(order, consumed) : new int[0]);
    }

    /**
     * Bucket sets whose key lies in the predicate's key range. Looks up each key
     * when the range is narrower than the attribute's key count, otherwise
     * scans the attribute's table.
     */
    private List<HashIdSet> containersFor(AttributeRange range) {
        if (range.isEmpty()) {
            return List.of();
        }
        var byKey = postings.getOrDefault(range.attribute(), null);
        if (byKey == null) {
            return List.of();
        }
        var ordinal = range.attribute().ordinal();
        var lowKey = Math.max(range.lowKey(configuration), minKeys[ordinal]);
        var highKey = Math.min(range.highKey(configuration), maxKeys[ordinal]);
        if (lowKey > highKey) {
            return List.of();
        }
        if (lowKey == highKey) {
            var set = byKey.getOrDefault(lowKey, null);
            return set == null ? List.of() : List.of(set);
        }
        var containers = new ArrayList<HashIdSet>();
        if (highKey - lowKey < byKey.size()) {
            for (var key = lowKey; key <= highKey; key++) {
                var set = byKey.getOrDefault(key, null);
                if (set != null) {
                    containers.add(set);
                }
            }
        } else {
            byKey.forEach((key, set) -> {
                if (key >= lowKey && key <= highKey) {
                    containers.add(set);
                }
            });
        }
        return containers;
    }

    private IdSet intersect(IdSet smaller, IdSet larger) {
        var result = new HashIdSet(smaller.size(), configuration.hashTableLoadFactor());
        var e = smaller.enumerator();
        while (e.hasNext()) {
            var id = e.nextInt();
            if (larger.contains(id)) {
                result.add(id);
            }
        }
        return result;
    }

    private int[] refineAndSort(IdSet result, List<AttributeRange> predicates) {
        var ids = result.toIntArray();
        var refinements = predicates.stream()
                .filter(predicate -> predicate.needsRefinement(configuration))
                .toList();
        if (!refinements.isEmpty()) {
            var kept = 0;
            for (var id : ids) {
                var property = store.get(id);
                if (refinements.stream().allMatch(predicate -> predicate.matches(property))) {
                    ids[kept++] = id;
                }
            }
            ids = Arrays.copyOf(ids, kept);
        }
        Arrays.sort(ids);
        return ids;
    }

    @Override
    public IndexStatistics statistics() {
        var distinctKeys = new EnumMap<Attribute, Integer>(Attribute.class);
        var postingKeys = 0;
        for (var entry : postings) {
            distinctKeys.put(entry.key(), entry.value().size());
            postingKeys += entry.value().size();
        }
        var bedrooms = Attribute.BEDROOMS.ordinal();
        var bathrooms = Attribute.BATHROOMS.ordinal();
        return new IndexStatistics(NAME, store.size(), postingKeys, distinctKeys,
                store.isEmpty() ? 0 : (int) maxKeys[bedrooms],
                store.isEmpty() ? 0d : maxKeys[bathrooms] / 2d,
                buildMillis);
    }

    @Override
    public String toString() {
        return "HashSetIndex{properties=" + store.size() + ", attributes=" + postings.size() + "}";
    }
}
