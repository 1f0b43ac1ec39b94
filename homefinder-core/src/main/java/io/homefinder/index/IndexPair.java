package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.storage.PropertyStore;

/**
 * Both indexes built from one store. Immutable; pass it to every query
 * instead of holding it in a global.
 */
public record IndexPair(
        PropertyStore store,
        HashSetIndex hashSetIndex,
        PostingListIndex postingListIndex,
        IndexConfiguration configuration) {

    public IndexPair {
        if (store == null || hashSetIndex == null || postingListIndex == null || configuration == null) {
            throw new IllegalArgumentException("store, indexes and configuration required");
        }
        if (hashSetIndex.store() != store || postingListIndex.store() != store) {
            throw new IllegalArgumentException("indexes must be built from the given store");
        }
    }
}
