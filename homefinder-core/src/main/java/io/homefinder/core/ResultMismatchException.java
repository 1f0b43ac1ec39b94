package io.homefinder.core;

import java.util.Arrays;

/**
 * Signals that the hash-set path and the posting-list path disagreed on the
 * ids matching the same filter. This is an index defect, never a caller error.
 */
public class ResultMismatchException extends HomefinderException {

    private final int[] onlyInHashSet;
    private final int[] onlyInPostingList;

    public ResultMismatchException(String filter, int[] onlyInHashSet, int[] onlyInPostingList) {
        super("Index paths disagree for " + filter
                + ": only in hash-set=" + Arrays.toString(onlyInHashSet)
                + ", only in posting-list=" + Arrays.toString(onlyInPostingList));
        this.onlyInHashSet = onlyInHashSet.clone();
        this.onlyInPostingList = onlyInPostingList.clone();
    }

    public int[] onlyInHashSet() {
        return onlyInHashSet.clone();
    }

    public int[] onlyInPostingList() {
        return onlyInPostingList.clone();
    }
}
