package io.homefinder.kernel;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Immutable posting list: property ids in strictly ascending order.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Ids are non-negative, strictly ascending and therefore duplicate-free.</li>
 *   <li>Iteration and {@link #toIntArray()} follow ascending id order.</li>
 *   <li>contains() is a binary search, O(log n).</li>
 * </ul>
 */
public final class PostingList implements IdSet {
    private static final PostingList EMPTY = new PostingList(new int[0]);

    private final int[] ids;

    private PostingList(int[] ids) {
        this.ids = ids;
    }

    public static PostingList empty() {
        return EMPTY;
    }

    /**
     * Copies the given ids, which must already be strictly ascending.
     *
     * @throws IllegalArgumentException if ids are negative, unsorted or duplicated
     */
    public static PostingList of(int... ids) {
        if (ids.length == 0) {
            return EMPTY;
        }
        var copy = ids.clone();
        if (!isStrictlyAscending(copy, copy.length)) {
            throw new IllegalArgumentException("ids must be non-negative and strictly ascending: " + Arrays.toString(ids));
        }
        return new PostingList(copy);
    }

    /**
     * Adopts an array the caller guarantees is strictly ascending and will not modify.
     */
    static PostingList wrap(int[] sortedIds, int length) {
        if (length == 0) {
            return EMPTY;
        }
        return new PostingList(length == sortedIds.length ? sortedIds : Arrays.copyOf(sortedIds, length));
    }

    public static Builder builder() {
        return new Builder(8);
    }

    public static Builder builder(int expectedSize) {
        return new Builder(expectedSize);
    }

    @Override
    public int size() {
        return ids.length;
    }

    /**
     * Id at the given position.
     */
    public int get(int index) {
        return ids[index];
    }

    public int first() {
        if (ids.length == 0) {
            throw new NoSuchElementException("empty posting list");
        }
        return ids[0];
    }

    public int last() {
        if (ids.length == 0) {
            throw new NoSuchElementException("empty posting list");
        }
        return ids[ids.length - 1];
    }

    @Override
    public boolean contains(int id) {
        return id >= 0 && Arrays.binarySearch(ids, id) >= 0;
    }

    @Override
    public int[] toIntArray() {
        return ids.clone();
    }

    @Override
    public IntEnumerator enumerator() {
        return new IntEnumerator() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < ids.length;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return ids[index++];
            }
        };
    }

    static boolean isStrictlyAscending(int[] values, int length) {
        for (var i = 0; i < length; i++) {
            if (values[i] < 0 || (i > 0 && values[i - 1] >= values[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(ids, ((PostingList) obj).ids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        return "PostingList" + Arrays.toString(ids);
    }

    /**
     * Accumulates ids in any order; {@link #build()} sorts and drops duplicates.
     * Not thread-safe.
     */
    public static final class Builder {
        private int[] values;
        private int size;

        private Builder(int expectedSize) {
            if (expectedSize < 0) {
                throw new IllegalArgumentException("expectedSize must be non-negative");
            }
            this.values = new int[Math.max(expectedSize, 1)];
        }

        public Builder add(int id) {
            if (id < 0) {
                throw new IllegalArgumentException("id must be non-negative: " + id);
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, values.length << 1);
            }
            values[size++] = id;
            return this;
        }

        public int size() {
            return size;
        }

        public PostingList build() {
            if (size == 0) {
                return EMPTY;
            }
            var sorted = Arrays.copyOf(values, size);
            if (!isStrictlyAscending(sorted, size)) {
                Arrays.sort(sorted);
            }
            var write = 1;
            for (var read = 1; read < sorted.length; read++) {
                if (sorted[read] != sorted[write - 1]) {
                    sorted[write++] = sorted[read];
                }
            }
            return wrap(sorted, write);
        }
    }
}
