package io.homefinder.index;

import java.util.Map;

/**
 * Build-time figures for one index.
 *
 * @param index          index name, "hash-set" or "posting-list"
 * @param properties     number of indexed properties
 * @param postingKeys    total number of (attribute, key) containers
 * @param distinctKeys   number of keys per attribute
 * @param maxBedrooms    largest bedroom count seen, 0 for an empty index
 * @param maxBathrooms   largest bathroom count seen, 0 for an empty index
 * @param buildMillis    wall-clock build time in milliseconds
 */
public record IndexStatistics(
        String index,
        int properties,
        int postingKeys,
        Map<Attribute, Integer> distinctKeys,
        int maxBedrooms,
        double maxBathrooms,
        long buildMillis) {

    public IndexStatistics {
        distinctKeys = Map.copyOf(distinctKeys);
    }
}
