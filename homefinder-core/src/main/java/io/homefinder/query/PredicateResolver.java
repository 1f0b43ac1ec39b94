package io.homefinder.query;

import io.homefinder.core.InvalidRangeException;
import io.homefinder.core.UnknownAttributeException;
import io.homefinder.index.Attribute;
import io.homefinder.index.AttributeRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates a {@link PropertyFilter} and turns it into {@link AttributeRange}s
 * in raw attribute units. Runs before either index is touched.
 * <p>
 * Numeric bounds are rounded inward to the attribute's unit: a bathroom
 * range {@code [1.2, 2.7]} becomes half-baths {@code [3, 5]}. An exact value
 * that is not representable (2.3 bathrooms) yields an empty range, which
 * matches nothing.
 */
public final class PredicateResolver {

    /**
     * @throws UnknownAttributeException if a name is not an indexed attribute
     * @throws InvalidRangeException     if a value or bound does not fit its attribute
     */
    public List<AttributeRange> resolve(PropertyFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter required");
        }
        var ranges = new ArrayList<AttributeRange>(filter.predicates().size() + filter.requiredFeatures().size());
        filter.predicates().forEach((name, value) -> ranges.add(resolve(attribute(name), name, value)));
        for (var feature : filter.requiredFeatures()) {
            var attribute = attribute(feature);
            if (!attribute.isFlag()) {
                throw new InvalidRangeException(feature, "is not a boolean feature");
            }
            ranges.add(AttributeRange.exactly(attribute, 1L));
        }
        return ranges;
    }

    private static Attribute attribute(String name) {
        return Attribute.fromName(name)
                .orElseThrow(() -> new UnknownAttributeException(name, Attribute.names()));
    }

    private static AttributeRange resolve(Attribute attribute, String name, FilterValue value) {
        if (attribute.isFlag()) {
            return resolveFlag(attribute, name, value);
        }
        var units = attribute.unitsPerValue();
        if (value instanceof FilterValue.Exact exact) {
            var number = number(name, exact.value(), "value");
            return AttributeRange.between(attribute, ceil(number, units), floor(number, units));
        }
        var range = (FilterValue.Range) value;
        if (range.min() == null && range.max() == null) {
            throw new InvalidRangeException(name, "range needs at least one bound");
        }
        var min = range.min() == null ? null : number(name, range.min(), "min");
        var max = range.max() == null ? null : number(name, range.max(), "max");
        if (min != null && max != null && min > max) {
            throw new InvalidRangeException(name, "min " + range.min() + " is greater than max " + range.max());
        }
        return AttributeRange.between(attribute,
                min == null ? Long.MIN_VALUE : ceil(min, units),
                max == null ? Long.MAX_VALUE : floor(max, units));
    }

    private static AttributeRange resolveFlag(Attribute attribute, String name, FilterValue value) {
        if (!(value instanceof FilterValue.Exact exact)) {
            throw new InvalidRangeException(name, "ranges are not supported on boolean features");
        }
        var raw = exact.value();
        if (raw instanceof Boolean flag) {
            return AttributeRange.exactly(attribute, flag ? 1L : 0L);
        }
        if (raw instanceof CharSequence text) {
            var normalized = text.toString().trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return AttributeRange.exactly(attribute, normalized.equals("true") ? 1L : 0L);
            }
        }
        throw new InvalidRangeException(name, "expected a boolean but got " + raw);
    }

    private static Double number(String name, Object value, String role) {
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof CharSequence text) {
            try {
                number = Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidRangeException(name, role + " is not numeric: '" + text + "'");
            }
        } else {
            throw new InvalidRangeException(name, role + " is not numeric: " + value);
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new InvalidRangeException(name, role + " must be finite: " + value);
        }
        return number;
    }

    private static long ceil(double value, int units) {
        return (long) Math.ceil(value * units);
    }

    private static long floor(double value, int units) {
        return (long) Math.floor(value * units);
    }
}
