package io.homefinder.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable collection of properties where each property's id is
 * its insertion position. Safe to share between threads.
 */
public final class PropertyStore implements Iterable<Property> {
    private static final PropertyStore EMPTY = new PropertyStore(List.of());

    private final List<Property> properties;

    private PropertyStore(List<Property> properties) {
        this.properties = properties;
    }

    public static PropertyStore empty() {
        return EMPTY;
    }

    /**
     * Wraps already-numbered properties.
     *
     * @throws IllegalArgumentException if any property's id differs from its position
     */
    public static PropertyStore of(List<Property> properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties required");
        }
        var copy = List.copyOf(properties);
        for (var i = 0; i < copy.size(); i++) {
            if (copy.get(i).id() != i) {
                throw new IllegalArgumentException("property at position " + i + " has id " + copy.get(i).id());
            }
        }
        return copy.isEmpty() ? EMPTY : new PropertyStore(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    /**
     * Property with the given id.
     *
     * @throws IndexOutOfBoundsException if no property has that id
     */
    public Property get(int id) {
        return properties.get(id);
    }

    /**
     * Properties for the given ids, in the order given.
     */
    public List<Property> hydrate(int[] ids, int limit) {
        var count = Math.min(ids.length, Math.max(limit, 0));
        var result = new ArrayList<Property>(count);
        for (var i = 0; i < count; i++) {
            result.add(properties.get(ids[i]));
        }
        return Collections.unmodifiableList(result);
    }

    public List<Property> asList() {
        return properties;
    }

    @Override
    public Iterator<Property> iterator() {
        return properties.iterator();
    }

    /**
     * Assigns ids in insertion order.
     */
    public static final class Builder {
        private final List<Property> properties = new ArrayList<>();

        private Builder() {
        }

        public Builder add(Property.Builder property) {
            properties.add(property.id(properties.size()).build());
            return this;
        }

        public PropertyStore build() {
            return properties.isEmpty() ? EMPTY : new PropertyStore(List.copyOf(properties));
        }
    }
}
