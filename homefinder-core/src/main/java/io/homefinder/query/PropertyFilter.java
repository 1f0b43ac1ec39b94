package io.homefinder.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Conjunctive filter as handed over by the request layer: attribute name to
 * exact value or range, plus the boolean features a property must have.
 * <pre>
 * PropertyFilter filter = PropertyFilter.builder()
 *     .equalTo("bedrooms", 3)
 *     .between("price", 200_000, 400_000)
 *     .require("garage")
 *     .build();
 * </pre>
 * Names are not validated here; see {@link PredicateResolver}.
 */
public final class PropertyFilter {
    private static final PropertyFilter ALL = new PropertyFilter(Map.of(), Set.of(), OptionalInt.empty());

    private final Map<String, FilterValue> predicates;
    private final Set<String> requiredFeatures;
    private final OptionalInt limit;

    private PropertyFilter(Map<String, FilterValue> predicates, Set<String> requiredFeatures, OptionalInt limit) {
        this.predicates = predicates;
        this.requiredFeatures = requiredFeatures;
        this.limit = limit;
    }

    /**
     * Filter without predicates; matches every property.
     */
    public static PropertyFilter all() {
        return ALL;
    }

    public static PropertyFilter of(Map<String, FilterValue> predicates, Set<String> requiredFeatures) {
        return builder().where(predicates).requireAll(requiredFeatures).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, FilterValue> predicates() {
        return predicates;
    }

    public Set<String> requiredFeatures() {
        return requiredFeatures;
    }

    /**
     * Maximum number of properties to hydrate into the result, if capped.
     */
    public OptionalInt limit() {
        return limit;
    }

    public boolean isEmpty() {
        return predicates.isEmpty() && requiredFeatures.isEmpty();
    }

    @Override
    public String toString() {
        return "PropertyFilter{predicates=" + predicates + ", features=" + requiredFeatures
                + (limit.isPresent() ? ", limit=" + limit.getAsInt() : "") + "}";
    }

    public static final class Builder {
        private final Map<String, FilterValue> predicates = new LinkedHashMap<>();
        private final Set<String> requiredFeatures = new LinkedHashSet<>();
        private OptionalInt limit = OptionalInt.empty();

        private Builder() {
        }

        public Builder where(String attribute, FilterValue value) {
            if (attribute == null || attribute.isBlank()) {
                throw new IllegalArgumentException("attribute required");
            }
            if (value == null) {
                throw new IllegalArgumentException("value required");
            }
            predicates.put(attribute, value);
            return this;
        }

        public Builder where(Map<String, FilterValue> values) {
            if (values != null) {
                values.forEach(this::where);
            }
            return this;
        }

        public Builder equalTo(String attribute, Object value) {
            return where(attribute, FilterValue.exact(value));
        }

        public Builder between(String attribute, Object min, Object max) {
            return where(attribute, FilterValue.range(min, max));
        }

        public Builder atLeast(String attribute, Object min) {
            return where(attribute, FilterValue.atLeast(min));
        }

        public Builder atMost(String attribute, Object max) {
            return where(attribute, FilterValue.atMost(max));
        }

        /**
         * Require a boolean feature, e.g. "garage" or "has_garage".
         */
        public Builder require(String feature) {
            if (feature == null || feature.isBlank()) {
                throw new IllegalArgumentException("feature required");
            }
            requiredFeatures.add(feature);
            return this;
        }

        public Builder requireAll(Set<String> features) {
            if (features != null) {
                features.forEach(this::require);
            }
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be non-negative: " + limit);
            }
            this.limit = OptionalInt.of(limit);
            return this;
        }

        public PropertyFilter build() {
            return new PropertyFilter(
                    Collections.unmodifiableMap(new LinkedHashMap<>(predicates)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(requiredFeatures)),
                    limit);
        }
    }
}
