package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.kernel.IdSets;
import io.homefinder.kernel.PostingList;
import io.homefinder.kernel.PostingLists;
import io.homefinder.storage.PropertyStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Inverted index whose containers are sorted posting lists.
 * <p>
 * <b>Build:</b> ids are grouped by (attribute, key), then each group is sorted
 * and deduplicated into a {@link PostingList}. Keys are kept in a sorted map so
 * a range predicate is a sub-map view.
 * <p>
 * <b>Query:</b> a range predicate's lists are unioned with the configured
 * {@link IndexConfiguration.MergeStrategy}; the per-predicate lists are then
 * merge-intersected shortest first. Results come out ascending, no sort needed.
 */
public final class PostingListIndex implements PropertyIndex {
    public static final String NAME = "posting-list";

    private final PropertyStore store;
    private final IndexConfiguration configuration;
    private final Map<Attribute, NavigableMap<Long, PostingList>> postings;
    private final long buildMillis;

    private PostingListIndex(PropertyStore store, IndexConfiguration configuration,
                             Map<Attribute, NavigableMap<Long, PostingList>> postings, long buildMillis) {
        this.store = store;
        this.configuration = configuration;
        this.postings = postings;
        this.buildMillis = buildMillis;
    }

    public static PostingListIndex build(PropertyStore store, IndexConfiguration configuration) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(configuration, "configuration");
        var start = System.nanoTime();
        var postings = new EnumMap<Attribute, NavigableMap<Long, PostingList>>(Attribute.class);
        for (var attribute : Attribute.values()) {
            var groups = new HashMap<Long, PostingList.Builder>();
            for (var property : store) {
                groups.computeIfAbsent(attribute.keyOf(property, configuration), ignored -> PostingList.builder())
                        .add(property.id());
            }
            var lists = new TreeMap<Long, PostingList>();
            groups.forEach((key, builder) -> lists.put(key, builder.build()));
            postings.put(attribute, Collections.unmodifiableNavigableMap(lists));
        }
        var buildMillis = (System.nanoTime() - start) / 1_000_000L;
        return new PostingListIndex(store, configuration, Collections.unmodifiableMap(postings), buildMillis);
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
     * Posting list stored under the attribute's key, or an empty list.
     */
    public PostingList lookup(Attribute attribute, long key) {
        var list = postings.get(attribute).get(key);
        return list == null ? PostingList.empty() : list;
    }

    /**
     * Keys present for the attribute, ascending.
     */
    public NavigableMap<Long, PostingList> postings(Attribute attribute) {
        return postings.get(attribute);
    }

    @Override
    public IndexEvaluation evaluate(List<AttributeRange> predicates) {
        if (predicates.isEmpty()) {
            return new IndexEvaluation(IdSets.allIds(store.size()), 0, 0);
        }
        var lookups = 0;
        var perPredicate = new ArrayList<List<PostingList>>(predicates.size());
        for (var predicate : predicates) {
            var lists = listsFor(predicate);
            if (lists.isEmpty()) {
                return IndexEvaluation.empty(lookups);
            }
            lookups += lists.size();
            perPredicate.add(lists);
        }

        var operations = 0;
        var merged = new ArrayList<PostingList>(perPredicate.size());
        for (var lists : perPredicate) {
            if (lists.size() == 1) {
                merged.add(lists.get(0));
                continue;
            }
            merged.add(union(lists));
            operations += lists.size() - 1;
        }

        merged.sort(Comparator.comparingInt(PostingList::size));
        var order = new int[merged.size()];
        var result = merged.get(0);
        order[0] = result.size();
        var consumed = 1;
        for (var i = 1; i < merged.size() && !result.isEmpty(); i++) {
            order[consumed++] = merged.get(i).size();
            result = PostingLists.intersect(result, merged.get(i));
            operations++;
        }
        return new IndexEvaluation(refine(result, predicates), lookups, operations,
                consumed > 1 ? Arrays.copyOf(order, consumed) : new int[0]);
    }

    private List<PostingList> listsFor(AttributeRange range) {
        if (range.isEmpty()) {
            return List.of();
        }
        var byKey = postings.get(range.attribute());
        var lowKey = range.lowKey(configuration);
        var highKey = range.highKey(configuration);
        if (lowKey == highKey) {
            var list = byKey.get(lowKey);
            return list == null ? List.of() : List.of(list);
        }
        return new ArrayList<>(byKey.subMap(lowKey, true, highKey, true).values());
    }

    private PostingList union(List<PostingList> lists) {
        return switch (configuration.mergeStrategy()) {
            case PAIRWISE -> PostingLists.unionPairwise(lists);
            case HEAP -> PostingLists.unionHeap(lists);
        };
    }

    private int[] refine(PostingList result, List<AttributeRange> predicates) {
        var refinements = predicates.stream()
                .filter(predicate -> predicate.needsRefinement(configuration))
                .toList();
        if (refinements.isEmpty()) {
            return result.toIntArray();
        }
        var kept = PostingList.builder(result.size());
        var e = result.enumerator();
        while (e.hasNext()) {
            var id = e.nextInt();
            var property = store.get(id);
            if (refinements.stream().allMatch(predicate -> predicate.matches(property))) {
                kept.add(id);
            }
        }
        return kept.build().toIntArray();
    }

    @Override
    public IndexStatistics statistics() {
        var distinctKeys = new EnumMap<Attribute, Integer>(Attribute.class);
        var postingKeys = 0;
        for (var entry : postings.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            distinctKeys.put(entry.getKey(), entry.getValue().size());
            postingKeys += entry.getValue().size();
        }
        var bedrooms = postings.get(Attribute.BEDROOMS);
        var bathrooms = postings.get(Attribute.BATHROOMS);
        return new IndexStatistics(NAME, store.size(), postingKeys, distinctKeys,
                bedrooms.isEmpty() ? 0 : bedrooms.lastKey().intValue(),
                bathrooms.isEmpty() ? 0d : bathrooms.lastKey() / 2d,
                buildMillis);
    }

    @Override
    public String toString() {
        return "PostingListIndex{properties=" + store.size() + ", attributes=" + postings.size() + "}";
    }
}
