package io.homefinder.query;

import io.homefinder.core.InvalidRangeException;
import io.homefinder.core.UnknownAttributeException;
import io.homefinder.index.Attribute;
import io.homefinder.index.AttributeRange;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PredicateResolverTest {

    private final PredicateResolver resolver = new PredicateResolver();

    @Test
    void emptyFilterResolvesToNoPredicates() {
        assertThat(resolver.resolve(PropertyFilter.all())).isEmpty();
    }

    @Test
    void exactValuesBecomePointRanges() {
        var ranges = resolver.resolve(PropertyFilter.builder()
                .equalTo("bedrooms", 3)
                .equalTo("bathrooms", 2.5)
                .equalTo("price", "250000")
                .build());

        assertThat(ranges).containsExactly(
                AttributeRange.exactly(Attribute.BEDROOMS, 3),
                AttributeRange.exactly(Attribute.BATHROOMS, 5),
                AttributeRange.exactly(Attribute.PRICE, 250_000));
    }

    @Test
    void rangesRoundInwardToAttributeUnits() {
        var ranges = resolver.resolve(PropertyFilter.builder()
                .between("bathrooms", 1.2, 2.7)
                .between("bedrooms", 1.5, 3.5)
                .build());

        assertThat(ranges).containsExactly(
                AttributeRange.between(Attribute.BATHROOMS, 3, 5),
                AttributeRange.between(Attribute.BEDROOMS, 2, 3));
    }

    @Test
    void unrepresentableExactValueMatchesNothing() {
        var range = resolver.resolve(PropertyFilter.builder().equalTo("bathrooms", 2.3).build()).get(0);

        assertThat(range.isEmpty()).isTrue();
    }

    @Test
    void missingBoundLeavesRangeOpen() {
        var ranges = resolver.resolve(PropertyFilter.builder()
                .atLeast("year_built", 1950)
                .atMost("price", 400_000)
                .build());

        assertThat(ranges).containsExactly(
                AttributeRange.atLeast(Attribute.YEAR_BUILT, 1950),
                AttributeRange.atMost(Attribute.PRICE, 400_000));
    }

    @Test
    void flagsAcceptBooleansAndBooleanText() {
        var ranges = resolver.resolve(PropertyFilter.builder()
                .equalTo("has_garage", true)
                .equalTo("basement", "FALSE")
                .build());

        assertThat(ranges).containsExactly(
                AttributeRange.exactly(Attribute.HAS_GARAGE, 1),
                AttributeRange.exactly(Attribute.HAS_BASEMENT, 0));
    }

    @Test
    void requiredFeaturesBecomeTrueFlags() {
        var ranges = resolver.resolve(PropertyFilter.of(Map.of(), Set.of("fireplace")));

        assertThat(ranges).containsExactly(AttributeRange.exactly(Attribute.HAS_FIREPLACE, 1));
    }

    @Test
    void unknownAttributeListsIndexedOnes() {
        var filter = PropertyFilter.builder().equalTo("pool", true).build();

        assertThatThrownBy(() -> resolver.resolve(filter))
                .isInstanceOf(UnknownAttributeException.class)
                .hasMessageContaining("'pool'")
                .hasMessageContaining("bedrooms")
                .satisfies(e -> assertThat(((UnknownAttributeException) e).attribute()).isEqualTo("pool"));
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().require("sauna").build()))
                .isInstanceOf(UnknownAttributeException.class);
    }

    @Test
    void rejectsInvertedRange() {
        var filter = PropertyFilter.builder().between("price", 300_000, 200_000).build();

        assertThatThrownBy(() -> resolver.resolve(filter))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("greater than max");
    }

    @Test
    void rejectsMalformedValues() {
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().equalTo("bedrooms", "three").build()))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("not numeric");
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().equalTo("price", Double.NaN).build()))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().equalTo("price", null).build()))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().between("price", null, null).build()))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("at least one bound");
    }

    @Test
    void rejectsRangesAndNonBooleansOnFlags() {
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().between("has_attic", 0, 1).build()))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().equalTo("has_attic", 1).build()))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("expected a boolean");
        assertThatThrownBy(() -> resolver.resolve(PropertyFilter.builder().require("bedrooms").build()))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("not a boolean feature");
    }
}
