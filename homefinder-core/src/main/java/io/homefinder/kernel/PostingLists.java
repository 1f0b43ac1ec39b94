package io.homefinder.kernel;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear-time algorithms over {@link PostingList}s. Every result is itself a
 * strictly ascending posting list.
 */
public final class PostingLists {

    private PostingLists() {
    }

    /**
     * Two-way merge of sorted lists, dropping ids present in both.
     */
    public static PostingList union(PostingList a, PostingList b) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        var out = new int[a.size() + b.size()];
        var n = 0;
        var i = 0;
        var j = 0;
        while (i < a.size() && j < b.size()) {
            var x = a.get(i);
            var y = b.get(j);
            if (x == y) {
                out[n++] = x;
                i++;
                j++;
            } else if (x < y) {
                out[n++] = x;
                i++;
            } else {
                out[n++] = y;
                j++;
            }
        }
        while (i < a.size()) {
            out[n++] = a.get(i++);
        }
        while (j < b.size()) {
            out[n++] = b.get(j++);
        }
        return PostingList.wrap(out, n);
    }

    /**
     * Unions the lists by folding {@link #union(PostingList, PostingList)} left to right.
     */
    public static PostingList unionPairwise(List<PostingList> lists) {
        var result = PostingList.empty();
        for (var list : lists) {
            result = union(result, list);
        }
        return result;
    }

    /**
     * Unions the lists in one k-way pass: a min-heap holds one cursor per
     * list, the smallest head is emitted unless equal to the last emitted id.
     */
    public static PostingList unionHeap(List<PostingList> lists) {
        var nonEmpty = new ArrayList<PostingList>(lists.size());
        var total = 0;
        for (var list : lists) {
            if (!list.isEmpty()) {
                nonEmpty.add(list);
                total += list.size();
            }
        }
        if (nonEmpty.isEmpty()) {
            return PostingList.empty();
        }
        if (nonEmpty.size() == 1) {
            return nonEmpty.get(0);
        }
        var heap = new PostingCursorHeap(nonEmpty);
        var out = new int[total];
        var n = 0;
        while (!heap.isEmpty()) {
            var id = heap.pollMin();
            if (n == 0 || out[n - 1] != id) {
                out[n++] = id;
            }
        }
        return PostingList.wrap(out, n);
    }

    /**
     * Merge-intersection: advance whichever cursor holds the smaller id, emit on
     * equality, stop as soon as either list is exhausted.
     */
    public static PostingList intersect(PostingList a, PostingList b) {
        if (a.isEmpty() || b.isEmpty()) {
            return PostingList.empty();
        }
        var out = new int[Math.min(a.size(), b.size())];
        var n = 0;
        var i = 0;
        var j = 0;
        while (i < a.size() && j < b.size()) {
            var x = a.get(i);
            var y = b.get(j);
            if (x == y) {
                out[n++] = x;
                i++;
                j++;
            } else if (x < y) {
                i++;
            } else {
                j++;
            }
        }
        return PostingList.wrap(out, n);
    }
}
