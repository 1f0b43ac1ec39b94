package io.homefinder.storage;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyStoreTest {

    @Test
    void builderAssignsIdsByPosition() {
        var store = PropertyStore.builder()
                .add(Property.builder().bedrooms(2))
                .add(Property.builder().bedrooms(4).id(99))
                .build();

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.get(0).id()).isZero();
        assertThat(store.get(1).id()).isEqualTo(1);
        assertThat(store.get(1).bedrooms()).isEqualTo(4);
    }

    @Test
    void ofRejectsIdsThatDoNotMatchPositions() {
        var misnumbered = List.of(Property.builder().id(1).build());

        assertThatThrownBy(() -> PropertyStore.of(misnumbered))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position 0");
        assertThatThrownBy(() -> PropertyStore.of(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyInputsShareTheEmptyStore() {
        assertThat(PropertyStore.of(List.of())).isSameAs(PropertyStore.empty());
        assertThat(PropertyStore.builder().build()).isSameAs(PropertyStore.empty());
        assertThat(PropertyStore.empty().isEmpty()).isTrue();
    }

    @Test
    void hydrateKeepsIdOrderAndHonoursLimit() {
        var store = PropertyStore.builder()
                .add(Property.builder().bedrooms(1))
                .add(Property.builder().bedrooms(2))
                .add(Property.builder().bedrooms(3))
                .build();

        assertThat(store.hydrate(new int[] {0, 2}, Integer.MAX_VALUE))
                .extracting(Property::bedrooms)
                .containsExactly(1, 3);
        assertThat(store.hydrate(new int[] {0, 1, 2}, 2)).hasSize(2);
        assertThat(store.hydrate(new int[] {0, 1, 2}, 0)).isEmpty();
        assertThatThrownBy(() -> store.hydrate(new int[] {0}, 1).add(store.get(1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void storeIsImmutable() {
        var store = PropertyStore.builder().add(Property.builder()).build();

        assertThatThrownBy(() -> store.asList().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(store).hasSize(1);
    }
}
