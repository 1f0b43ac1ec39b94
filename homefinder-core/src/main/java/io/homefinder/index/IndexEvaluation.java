package io.homefinder.index;

import java.util.Arrays;

/**
 * Outcome of evaluating a conjunctive predicate list against one index.
 * <p>
 * {@code ids} is always ascending. {@code lookups} counts containers fetched
 * from the index; {@code setOperations} counts the union and intersection
 * steps performed on them. A query that stops at an empty lookup reports zero
 * set operations.
 * <p>
 * {@code intersectionOrder} lists the sizes of the per-predicate operands in
 * the order they entered the intersection; it is ascending for both indexes.
 * Operands skipped after the running result became empty are not listed.
 */
public final class IndexEvaluation {
    private final int[] ids;
    private final int lookups;
    private final int setOperations;
    private final int[] intersectionOrder;

    IndexEvaluation(int[] ids, int lookups, int setOperations) {
        this(ids, lookups, setOperations, new int[0]);
    }

    IndexEvaluation(int[] ids, int lookups, int setOperations, int[] intersectionOrder) {
        this.ids = ids;
        this.lookups = lookups;
        this.setOperations = setOperations;
        this.intersectionOrder = intersectionOrder;
    }

    public static IndexEvaluation of(int[] ids, int lookups, int setOperations) {
        return new IndexEvaluation(ids.clone(), lookups, setOperations);
    }

    static IndexEvaluation empty(int lookups) {
        return new IndexEvaluation(new int[0], lookups, 0);
    }

    public int[] ids() {
        return ids.clone();
    }

    public int size() {
        return ids.length;
    }

    public int lookups() {
        return lookups;
    }

    public int setOperations() {
        return setOperations;
    }

    /**
     * Operand sizes in intersection order; empty when fewer than two
     * predicates reached the intersection phase.
     */
    public int[] intersectionOrder() {
        return intersectionOrder.clone();
    }

    @Override
    public String toString() {
        return "IndexEvaluation{matches=" + ids.length + ", lookups=" + lookups
                + ", setOperations=" + setOperations
                + ", intersectionOrder=" + Arrays.toString(intersectionOrder) + ", ids=" + Arrays.toString(ids) + "}";
    }
}
