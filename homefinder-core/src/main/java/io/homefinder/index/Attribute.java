package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.storage.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Indexed projections of a {@link Property}.
 * <p>
 * Each attribute maps a property to a <em>raw value</em> (a long in the
 * attribute's own unit) and the raw value to an index <em>key</em>:
 * <ul>
 *   <li>{@link Kind#DISCRETE}: key = raw value. Bathrooms use half-bath units.</li>
 *   <li>{@link Kind#BUCKETED}: key = {@code floorDiv(raw, bucketWidth)}; bucket
 *       {@code k} covers raw values {@code [k*w, (k+1)*w)}.</li>
 *   <li>{@link Kind#FLAG}: key = 1 for true, 0 for false.</li>
 * </ul>
 */
public enum Attribute {
    BEDROOMS("bedrooms", Kind.DISCRETE, 1) {
        @Override
        public long rawValue(Property property) {
            return property.bedrooms();
        }
    },
    BATHROOMS("bathrooms", Kind.DISCRETE, 2) {
        @Override
        public long rawValue(Property property) {
            return property.halfBaths();
        }
    },
    PRICE("price", Kind.BUCKETED, 1) {
        @Override
        public long rawValue(Property property) {
            return property.price();
        }

        @Override
        public long bucketWidth(IndexConfiguration configuration) {
            return configuration.priceBucketWidth();
        }
    },
    YEAR_BUILT("year_built", Kind.BUCKETED, 1) {
        @Override
        public long rawValue(Property property) {
            return property.yearBuilt();
        }

        @Override
        public long bucketWidth(IndexConfiguration configuration) {
            return configuration.yearBuiltBucketWidth();
        }
    },
    HAS_BASEMENT("has_basement", Kind.FLAG, 1) {
        @Override
        public long rawValue(Property property) {
            return property.hasBasement() ? 1 : 0;
        }
    },
    HAS_FIREPLACE("has_fireplace", Kind.FLAG, 1) {
        @Override
        public long rawValue(Property property) {
            return property.hasFireplace() ? 1 : 0;
        }
    },
    HAS_ATTIC("has_attic", Kind.FLAG, 1) {
        @Override
        public long rawValue(Property property) {
            return property.hasAttic() ? 1 : 0;
        }
    },
    HAS_GARAGE("has_garage", Kind.FLAG, 1) {
        @Override
        public long rawValue(Property property) {
            return property.hasGarage() ? 1 : 0;
        }
    };

    private static final String FLAG_PREFIX = "has_";
    private static final List<String> NAMES;

    static {
        var names = new ArrayList<String>();
        for (var attribute : values()) {
            names.add(attribute.attributeName);
        }
        NAMES = Collections.unmodifiableList(names);
    }

    private final String attributeName;
    private final Kind kind;
    private final int unitsPerValue;

    Attribute(String attributeName, Kind kind, int unitsPerValue) {
        this.attributeName = attributeName;
        this.kind = kind;
        this.unitsPerValue = unitsPerValue;
    }

    /**
     * Value of this attribute for the property, in raw units.
     */
    public abstract long rawValue(Property property);

    /**
     * Raw units that make up one caller-facing unit (2 for bathrooms, else 1).
     */
    public int unitsPerValue() {
        return unitsPerValue;
    }

    /**
     * Width of one key in raw units; 1 unless the attribute is bucketed.
     */
    public long bucketWidth(IndexConfiguration configuration) {
        return 1L;
    }

    public long keyOf(long rawValue, IndexConfiguration configuration) {
        return Math.floorDiv(rawValue, bucketWidth(configuration));
    }

    public long keyOf(Property property, IndexConfiguration configuration) {
        return keyOf(rawValue(property), configuration);
    }

    public String attributeName() {
        return attributeName;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFlag() {
        return kind == Kind.FLAG;
    }

    /**
     * Resolves a caller-facing name. Matching ignores case and treats '-' as '_';
     * flags also match without their {@code has_} prefix ("garage").
     */
    public static Optional<Attribute> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (var attribute : values()) {
            if (attribute.attributeName.equals(normalized)
                    || (attribute.isFlag() && attribute.attributeName.equals(FLAG_PREFIX + normalized))) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    /**
     * Names of all indexed attributes, in declaration order.
     */
    public static List<String> names() {
        return NAMES;
    }

    @Override
    public String toString() {
        return attributeName;
    }

    public enum Kind {
        DISCRETE,
        BUCKETED,
        FLAG
    }
}
