package io.homefinder.query;

/**
 * Requested value of one attribute: an exact value or an inclusive range.
 * Values stay untyped here; {@link PredicateResolver} checks them against
 * the attribute they are applied to.
 */
public sealed interface FilterValue permits FilterValue.Exact, FilterValue.Range {

    static FilterValue exact(Object value) {
        return new Exact(value);
    }

    static FilterValue range(Object min, Object max) {
        return new Range(min, max);
    }

    static FilterValue atLeast(Object min) {
        return new Range(min, null);
    }

    static FilterValue atMost(Object max) {
        return new Range(null, max);
    }

    record Exact(Object value) implements FilterValue {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * Inclusive range; a null bound leaves that side open.
     */
    record Range(Object min, Object max) implements FilterValue {
        @Override
        public String toString() {
            return "[" + (min == null ? "" : min) + ".." + (max == null ? "" : max) + "]";
        }
    }
}
