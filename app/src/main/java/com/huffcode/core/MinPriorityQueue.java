package com.huffcode.core;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Binary min-heap of arena nodes, ordered by weight.
 * <p>
 * Ties between equal weights are broken by arena index, i.e. allocation
 * order. Leaves are allocated in ascending symbol order before any internal
 * node, so equal-weight leaves come out by ascending byte value and ahead of
 * internal nodes of the same weight.
 */
public class MinPriorityQueue {

    private final NodeArena arena;
    private int[] heap;
    private int size;

    public MinPriorityQueue(NodeArena arena, int initialCapacity) {
        this.arena = arena;
        this.heap = new int[Math.max(1, initialCapacity)];
    }

    /**
     * Insert a node. O(log n).
     */
    public void insert(int node) {
        // validates the index against the arena
        arena.getWeight(node);
        if (size == heap.length) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        heap[size] = node;
        siftUp(size++);
    }

    /**
     * Remove and return the lowest node. O(log n).
     *
     * @throws NoSuchElementException If the queue is empty
     */
    public int extractMin() {
        if (size == 0) {
            throw new NoSuchElementException("Priority queue is empty");
        }
        int min = heap[0];
        heap[0] = heap[--size];
        if (size > 0) {
            siftDown(0);
        }
        return min;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private void siftUp(int pos) {
        int node = heap[pos];
        while (pos > 0) {
            int parent = (pos - 1) >>> 1;
            if (!precedes(node, heap[parent])) {
                break;
            }
            heap[pos] = heap[parent];
            pos = parent;
        }
        heap[pos] = node;
    }

    private void siftDown(int pos) {
        int node = heap[pos];
        int half = size >>> 1;
        while (pos < half) {
            int child = 2 * pos + 1;
            int right = child + 1;
            if (right < size && precedes(heap[right], heap[child])) {
                child = right;
            }
            if (!precedes(heap[child], node)) {
                break;
            }
            heap[pos] = heap[child];
            pos = child;
        }
        heap[pos] = node;
    }

    private boolean precedes(int a, int b) {
        int cmp = Long.compare(arena.getWeight(a), arena.getWeight(b));
        if (cmp != 0) return cmp < 0;
        return a < b;
    }
}
