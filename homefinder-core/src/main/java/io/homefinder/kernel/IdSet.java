package io.homefinder.kernel;

/**
 * Read-only view of a set of property ids.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>This is a <b>set</b> - no duplicate ids.</li>
 *   <li>size() returns the cardinality (number of unique ids).</li>
 *   <li>contains() tests membership; cost depends on the implementation.</li>
 *   <li>toIntArray() returns a copy that is safe to modify.</li>
 *   <li>Iteration order is implementation-defined. {@link PostingList} iterates
 *       in ascending order, {@link HashIdSet} in table order.</li>
 * </ul>
 */
public interface IdSet {
    /**
     * Returns the number of unique ids in this set.
     * @return cardinality (always non-negative)
     */
    int size();

    /**
     * Tests if the given id is present in this set.
     * @param id the property id to test
     * @return true if present, false otherwise
     */
    boolean contains(int id);

    /**
     * Returns a copy of all ids in this set, in iteration order.
     * @return array of length size()
     */
    int[] toIntArray();

    /**
     * Returns an enumerator over the ids of this set.
     */
    IntEnumerator enumerator();

    default boolean isEmpty() {
        return size() == 0;
    }
}
