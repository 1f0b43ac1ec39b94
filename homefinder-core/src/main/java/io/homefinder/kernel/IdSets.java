package io.homefinder.kernel;

import java.util.NoSuchElementException;

public final class IdSets {
    private static final IdSet EMPTY = new IdSet() {
        @Override
        public int size() {
            return 0;
        }

        @Override
        public boolean contains(int id) {
            return false;
        }

        @Override
        public int[] toIntArray() {
            return new int[0];
        }

        @Override
        public IntEnumerator enumerator() {
            return new IntEnumerator() {
                @Override
                public boolean hasNext() {
                    return false;
                }

                @Override
                public int nextInt() {
                    throw new NoSuchElementException();
                }
            };
        }

        @Override
        public String toString() {
            return "IdSets.empty()";
        }
    };

    private IdSets() {
    }

    public static IdSet empty() {
        return EMPTY;
    }

    /**
     * Ascending ids {@code [0, count)}, the result of a filter with no predicates.
     */
    public static int[] allIds(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        var ids = new int[count];
        for (var i = 0; i < count; i++) {
            ids[i] = i;
        }
        return ids;
    }
}
