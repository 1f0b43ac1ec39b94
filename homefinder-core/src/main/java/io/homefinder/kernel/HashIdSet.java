package io.homefinder.kernel;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Unordered, duplicate-free id set backed by a {@link HashTable}.
 * <p>
 * Membership tests are expected O(1). Iteration follows table slot order,
 * which is unrelated to id order; callers needing a deterministic order sort
 * the output of {@link #toIntArray()}.
 */
public final class HashIdSet implements MutableIdSet {
    private final HashTable<Integer, Boolean> table;

    public HashIdSet() {
        this.table = new HashTable<>();
    }

    /**
     * Set sized so that {@code expectedSize} ids fit without a rehash.
     */
    public HashIdSet(int expectedSize, double loadFactor) {
        if (expectedSize < 0) {
            throw new IllegalArgumentException("expectedSize must be non-negative");
        }
        this.table = new HashTable<>(Math.max(HashTable.DEFAULT_CAPACITY, (int) (expectedSize / loadFactor) + 1), loadFactor);
    }

    private HashIdSet(HashTable<Integer, Boolean> table) {
        this.table = table;
    }

    /**
     * Set whose backing table starts with exactly {@code initialCapacity}
     * slots (rounded up to a power of two).
     */
    public static HashIdSet withCapacity(int initialCapacity, double loadFactor) {
        return new HashIdSet(new HashTable<>(initialCapacity, loadFactor));
    }

    @Override
    public boolean add(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative: " + id);
        }
        return table.put(id, Boolean.TRUE) == null;
    }

    @Override
    public int size() {
        return table.size();
    }

    int capacity() {
        return table.capacity();
    }

    @Override
    public boolean contains(int id) {
        return id >= 0 && table.contains(id);
    }

    @Override
    public int[] toIntArray() {
        var result = new int[table.size()];
        var it = table.keyIterator();
        var i = 0;
        while (it.hasNext()) {
            result[i++] = it.next();
        }
        return result;
    }

    /**
     * Ids of this set in ascending order.
     */
    public int[] toSortedArray() {
        var result = toIntArray();
        Arrays.sort(result);
        return result;
    }

    @Override
    public IntEnumerator enumerator() {
        var it = table.keyIterator();
        return new IntEnumerator() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public int nextInt() {
                if (!it.hasNext()) {
                    throw new NoSuchElementException();
                }
                return it.next();
            }
        };
    }

    @Override
    public String toString() {
        return "HashIdSet" + Arrays.toString(toSortedArray());
    }
}
