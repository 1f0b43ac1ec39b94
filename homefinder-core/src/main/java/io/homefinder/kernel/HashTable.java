package io.homefinder.kernel;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Open-addressing hash table with linear scanning on collision.
 * <p>
 * <b>Layout:</b> parallel key/value arrays whose capacity is a power of two.
 * A key's home slot is its FNV-1a hash (computed over the four bytes of
 * {@link Object#hashCode()}) masked by {@code capacity - 1}; collisions step
 * forward one slot at a time, wrapping at the end of the array.
 * <p>
 * <b>Removal</b> leaves a tombstone so that collision chains running through the
 * slot stay intact. Tombstones are reused by later inserts and dropped on rehash.
 * <p>
 * <b>Resize:</b> when live entries plus tombstones would exceed
 * {@code capacity * loadFactor} the table is rehashed, doubling the capacity
 * unless most of the occupancy was tombstones. Because the load factor is
 * below one there is always an empty slot, so every lookup terminates.
 * <p>
 * Null keys and null values are rejected; {@link #get(Object)} reports an
 * absent key as {@link Optional#empty()}.
 * <p>
 * Not thread-safe for writers. A table that is no longer mutated after being
 * safely published may be read from any number of threads.
 *
 * @param <K> key type, must implement {@code equals}/{@code hashCode}
 * @param <V> value type
 */
public final class HashTable<K, V> implements Iterable<HashTable.Entry<K, V>> {
    static final int DEFAULT_CAPACITY = 16;
    static final double DEFAULT_LOAD_FACTOR = 0.75d;

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;
    private static final Object TOMBSTONE = new Object();

    private final double loadFactor;
    private Object[] keys;
    private Object[] values;
    private int size;
    private int tombstones;
    private int threshold;

    public HashTable() {
        this(DEFAULT_CAPACITY, DEFAULT_LOAD_FACTOR);
    }

    public HashTable(int initialCapacity) {
        this(initialCapacity, DEFAULT_LOAD_FACTOR);
    }

    public HashTable(int initialCapacity, double loadFactor) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        if (!(loadFactor > 0d && loadFactor < 1d)) {
            throw new IllegalArgumentException("loadFactor must be in (0, 1): " + loadFactor);
        }
        this.loadFactor = loadFactor;
        allocate(tableSizeFor(initialCapacity));
    }

    /**
     * Associates the value with the key, replacing any previous value.
     *
     * @return the previous value, or null if the key was absent
     */
    @SuppressWarnings("unchecked")
    public V put(K key, V value) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        var slot = findSlot(key);
        if (slot >= 0) {
            var previous = (V) values[slot];
            values[slot] = value;
            return previous;
        }
        insertAt(-slot - 1, key, value);
        return null;
    }

    /**
     * Looks up the value for the key.
     *
     * @return the value, or empty if the key is absent
     */
    public Optional<V> get(K key) {
        return Optional.ofNullable(getOrDefault(key, null));
    }

    @SuppressWarnings("unchecked")
    public V getOrDefault(K key, V defaultValue) {
        if (key == null) {
            return defaultValue;
        }
        var slot = findSlot(key);
        return slot >= 0 ? (V) values[slot] : defaultValue;
    }

    public boolean contains(K key) {
        return key != null && findSlot(key) >= 0;
    }

    /**
     * Returns the value for the key, first storing the factory's value if the key is absent.
     */
    @SuppressWarnings("unchecked")
    public V computeIfAbsent(K key, Function<? super K, ? extends V> factory) {
        requireKey(key);
        var slot = findSlot(key);
        if (slot >= 0) {
            return (V) values[slot];
        }
        V created = Objects.requireNonNull(factory.apply(key), "factory returned null");
        insertAt(-slot - 1, key, created);
        return created;
    }

    /**
     * Removes the key if present.
     *
     * @return true if an entry was removed
     */
    public boolean remove(K key) {
        if (key == null) {
            return false;
        }
        var slot = findSlot(key);
        if (slot < 0) {
            return false;
        }
        keys[slot] = TOMBSTONE;
        values[slot] = null;
        size--;
        tombstones++;
        return true;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of slots currently allocated.
     */
    public int capacity() {
        return keys.length;
    }

    @SuppressWarnings("unchecked")
    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (var i = 0; i < keys.length; i++) {
            var key = keys[i];
            if (key != null && key != TOMBSTONE) {
                action.accept((K) key, (V) values[i]);
            }
        }
    }

    @Override
    public Iterator<Entry<K, V>> iterator() {
        return new SlotIterator<>() {
            @Override
            @SuppressWarnings("unchecked")
            Entry<K, V> at(int slot) {
                return new Entry<>((K) keys[slot], (V) values[slot]);
            }
        };
    }

    public Iterator<K> keyIterator() {
        return new SlotIterator<>() {
            @Override
            @SuppressWarnings("unchecked")
            K at(int slot) {
                return (K) keys[slot];
            }
        };
    }

    /**
     * Index of the key's slot if present, otherwise {@code -(insertionSlot + 1)}
     * where insertionSlot is the first tombstone on the collision path, or the
     * empty slot that ended it.
     */
    private int findSlot(Object key) {
        var mask = keys.length - 1;
        var index = fnv1a(key.hashCode()) & mask;
        var firstTombstone = -1;
        while (true) {
            var current = keys[index];
            if (current == null) {
                return -((firstTombstone >= 0 ? firstTombstone : index) + 1);
            }
            if (current == TOMBSTONE) {
                if (firstTombstone < 0) {
                    firstTombstone = index;
                }
            } else if (current.equals(key)) {
                return index;
            }
            index = (index + 1) & mask;
        }
    }

    private void insertAt(int slot, Object key, Object value) {
        if (keys[slot] == TOMBSTONE) {
            tombstones--;
        } else if (size + tombstones + 1 > threshold) {
            rehash();
            slot = -findSlot(key) - 1;
        }
        keys[slot] = key;
        values[slot] = value;
        size++;
    }

    private void rehash() {
        var oldKeys = keys;
        var oldValues = values;
        // Mostly tombstones: rebuild at the same size instead of growing.
        var newCapacity = size + 1 > threshold / 2 ? oldKeys.length << 1 : oldKeys.length;
        allocate(newCapacity);
        var mask = newCapacity - 1;
        for (var i = 0; i < oldKeys.length; i++) {
            var key = oldKeys[i];
            if (key == null || key == TOMBSTONE) {
                continue;
            }
            var index = fnv1a(key.hashCode()) & mask;
            while (keys[index] != null) {
                index = (index + 1) & mask;
            }
            keys[index] = key;
            values[index] = oldValues[i];
            size++;
        }
    }

    private void allocate(int capacity) {
        keys = new Object[capacity];
        values = new Object[capacity];
        size = 0;
        tombstones = 0;
        threshold = Math.min(capacity - 1, (int) (capacity * loadFactor));
    }

    static int fnv1a(int value) {
        var hash = FNV_OFFSET_BASIS;
        for (var shift = 0; shift < Integer.SIZE; shift += Byte.SIZE) {
            hash ^= (value >>> shift) & 0xFF;
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static int tableSizeFor(int capacity) {
        var n = Integer.highestOneBit(Math.max(capacity, 2) - 1) << 1;
        return n < 0 ? 1 << 30 : n;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{");
        forEach((k, v) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(k).append('=').append(v);
        });
        return sb.append('}').toString();
    }

    public record Entry<K, V>(K key, V value) { }

    private abstract class SlotIterator<T> implements Iterator<T> {
        private int next = advance(0);

        abstract T at(int slot);

        @Override
        public boolean hasNext() {
            return next < keys.length;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var slot = next;
            next = advance(slot + 1);
            return at(slot);
        }

        private int advance(int from) {
            var i = from;
            while (i < keys.length && (keys[i] == null || keys[i] == TOMBSTONE)) {
                i++;
            }
            return i;
        }
    }
}
