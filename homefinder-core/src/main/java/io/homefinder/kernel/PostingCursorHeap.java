package io.homefinder.kernel;

import java.util.List;

/**
 * Binary min-heap of cursors into posting lists, ordered by each cursor's
 * current id. Used for k-way merges.
 */
final class PostingCursorHeap {
    private final List<PostingList> lists;
    private final int[] positions;
    // heap of list indexes
    private final int[] heap;
    private int size;

    PostingCursorHeap(List<PostingList> lists) {
        this.lists = lists;
        this.positions = new int[lists.size()];
        this.heap = new int[lists.size()];
        for (var i = 0; i < lists.size(); i++) {
            if (!lists.get(i).isEmpty()) {
                heap[size] = i;
                siftUp(size++);
            }
        }
    }

    boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the smallest current id and advances its cursor.
     */
    int pollMin() {
        var list = heap[0];
        var id = head(list);
        positions[list]++;
        if (positions[list] == lists.get(list).size()) {
            heap[0] = heap[--size];
        }
        if (size > 0) {
            siftDown(0);
        }
        return id;
    }

    private int head(int list) {
        return lists.get(list).get(positions[list]);
    }

    private void siftUp(int index) {
        var i = index;
        while (i > 0) {
            var parent = (i - 1) >>> 1;
            if (head(heap[i]) >= head(heap[parent])) {
                break;
            }
            swap(i, parent);
            i = parent;
        }
    }

    private void siftDown(int index) {
        var i = index;
        while (true) {
            var left = 2 * i + 1;
            var right = left + 1;
            var smallest = i;
            if (left < size && head(heap[left]) < head(heap[smallest])) {
                smallest = left;
            }
            if (right < size && head(heap[right]) < head(heap[smallest])) {
                smallest = right;
            }
            if (smallest == i) {
                return;
            }
            swap(i, smallest);
            i = smallest;
        }
    }

    private void swap(int a, int b) {
        var tmp = heap[a];
        heap[a] = heap[b];
        heap[b] = tmp;
    }
}
