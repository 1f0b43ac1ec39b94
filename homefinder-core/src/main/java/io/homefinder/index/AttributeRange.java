package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.storage.Property;

/**
 * A validated predicate: the attribute's raw value must lie in
 * {@code [low, high]}, both ends inclusive. Open sides use
 * {@link Long#MIN_VALUE} / {@link Long#MAX_VALUE}.
 * <p>
 * Indexes translate the range into the keys {@code [lowKey, highKey]}. For a
 * bucketed attribute whose bounds fall inside a bucket the key range
 * over-approximates and candidates must be checked with {@link #matches(Property)}.
 */
public record AttributeRange(Attribute attribute, long low, long high) {

    public AttributeRange {
        if (attribute == null) {
            throw new IllegalArgumentException("attribute required");
        }
    }

    public static AttributeRange exactly(Attribute attribute, long rawValue) {
        return new AttributeRange(attribute, rawValue, rawValue);
    }

    public static AttributeRange between(Attribute attribute, long low, long high) {
        return new AttributeRange(attribute, low, high);
    }

    public static AttributeRange atLeast(Attribute attribute, long low) {
        return new AttributeRange(attribute, low, Long.MAX_VALUE);
    }

    public static AttributeRange atMost(Attribute attribute, long high) {
        return new AttributeRange(attribute, Long.MIN_VALUE, high);
    }

    /**
     * True when no raw value can satisfy the range.
     */
    public boolean isEmpty() {
        return low > high;
    }

    public boolean isPoint() {
        return low == high;
    }

    public long lowKey(IndexConfiguration configuration) {
        return attribute.keyOf(low, configuration);
    }

    public long highKey(IndexConfiguration configuration) {
        return attribute.keyOf(high, configuration);
    }

    /**
     * True if the union of buckets in {@code [lowKey, highKey]} may contain
     * values outside the range.
     */
    public boolean needsRefinement(IndexConfiguration configuration) {
        var width = attribute.bucketWidth(configuration);
        if (width == 1L || isEmpty()) {
            return false;
        }
        var lowCut = low != Long.MIN_VALUE && Math.floorMod(low, width) != 0;
        var highCut = high != Long.MAX_VALUE && Math.floorMod(high, width) != width - 1;
        return lowCut || highCut;
    }

    public boolean matches(Property property) {
        var raw = attribute.rawValue(property);
        return raw >= low && raw <= high;
    }

    @Override
    public String toString() {
        if (isPoint()) {
            return attribute + "=" + low;
        }
        return attribute + " in [" + (low == Long.MIN_VALUE ? "-inf" : String.valueOf(low))
                + ", " + (high == Long.MAX_VALUE ? "+inf" : String.valueOf(high)) + "]";
    }
}
