package io.homefinder.kernel;

/**
 * Id set that can still grow. Only index builders and per-query scratch
 * code hold one; published indexes expose the read-only {@link IdSet} view.
 */
public interface MutableIdSet extends IdSet {
    /**
     * Adds an id to this set. Adding an id that is already present is a no-op.
     *
     * @param id non-negative property id
     * @return true if the set changed
     * @throws IllegalArgumentException if id is negative
     */
    boolean add(int id);

    /**
     * Adds every id of the other set.
     */
    default void addAll(IdSet other) {
        var e = other.enumerator();
        while (e.hasNext()) {
            add(e.nextInt());
        }
    }
}
