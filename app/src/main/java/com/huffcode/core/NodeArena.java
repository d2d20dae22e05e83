package com.huffcode.core;

import com.huffcode.error.AllocationFailureException;

/**
 * Contiguous storage for the nodes of one Huffman tree.
 * <p>
 * Nodes are addressed by their index in the arena, which is also their
 * allocation order. A leaf holds a symbol and no children; an internal node
 * holds two children and no symbol. All nodes are discarded together by
 * {@link #recycle()} or {@link #release()}; each of these bumps the arena
 * generation so that holders of stale indices can detect it.
 */
public final class NodeArena {

    public static final int NO_NODE = -1;
    public static final int NO_SYMBOL = -1;

    private final int capacity;
    private int[] symbols;
    private long[] weights;
    private int[] lefts;
    private int[] rights;
    private int size;
    private int generation;
    private boolean released;

    NodeArena(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Arena capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        try {
            this.symbols = new int[capacity];
            this.weights = new long[capacity];
            this.lefts = new int[capacity];
            this.rights = new int[capacity];
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException("Cannot allocate arena of " + capacity + " nodes", e);
        }
    }

    /**
     * Allocate a leaf node.
     *
     * @return Index of the new node
     */
    public int allocateLeaf(int symbol, long weight) {
        if (symbol < 0 || symbol >= FrequencyTable.ALPHABET_SIZE) {
            throw new IllegalArgumentException("Symbol out of range: " + symbol);
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Negative weight: " + weight);
        }
        int node = nextIndex();
        symbols[node] = symbol;
        weights[node] = weight;
        lefts[node] = NO_NODE;
        rights[node] = NO_NODE;
        return node;
    }

    /**
     * Allocate an internal node whose weight is the sum of its children.
     *
     * @return Index of the new node
     */
    public int allocateInternal(int left, int right) {
        checkNode(left);
        checkNode(right);
        int node = nextIndex();
        symbols[node] = NO_SYMBOL;
        weights[node] = weights[left] + weights[right];
        lefts[node] = left;
        rights[node] = right;
        return node;
    }

    private int nextIndex() {
        checkLive();
        if (size == capacity) {
            throw new AllocationFailureException("Node arena exhausted (capacity " + capacity + ")");
        }
        return size++;
    }

    public boolean isLeaf(int node) {
        checkNode(node);
        return lefts[node] == NO_NODE && rights[node] == NO_NODE;
    }

    public int getSymbol(int node) {
        checkNode(node);
        return symbols[node];
    }

    public long getWeight(int node) {
        checkNode(node);
        return weights[node];
    }

    public int getLeft(int node) {
        checkNode(node);
        return lefts[node];
    }

    public int getRight(int node) {
        checkNode(node);
        return rights[node];
    }

    /**
     * Number of nodes allocated since the arena was acquired.
     */
    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public int generation() {
        return generation;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Discard every node at once and make the storage available for a new run.
     */
    void recycle() {
        checkLive();
        size = 0;
        generation++;
    }

    /**
     * Discard every node and drop the backing storage. The arena cannot be used again.
     */
    void release() {
        if (released) {
            return;
        }
        released = true;
        generation++;
        size = 0;
        symbols = null;
        weights = null;
        lefts = null;
        rights = null;
    }

    private void checkLive() {
        if (released) {
            throw new IllegalStateException("Node arena has been released");
        }
    }

    private void checkNode(int node) {
        checkLive();
        if (node < 0 || node >= size) {
            throw new IndexOutOfBoundsException("No node " + node + " in arena of size " + size);
        }
    }
}
