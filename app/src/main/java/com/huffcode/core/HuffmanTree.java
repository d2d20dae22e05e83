package com.huffcode.core;

/**
 * Huffman tree whose nodes live in a {@link NodeArena}.
 * <p>
 * Closing the tree hands the arena back to its allocator, which discards
 * every node at once. Any access after that, or after the arena has been
 * recycled for another run, throws {@link IllegalStateException}.
 */
public class HuffmanTree implements AutoCloseable {

    private final ArenaAllocator allocator;
    private final NodeArena arena;
    private final int generation;
    private final int root;
    private boolean closed;

    HuffmanTree(ArenaAllocator allocator, NodeArena arena, int root) {
        this.allocator = allocator;
        this.arena = arena;
        this.generation = arena.generation();
        this.root = root;
    }

    public int getRoot() {
        checkLive();
        return root;
    }

    public boolean isLeaf(int node) {
        return checkLive().isLeaf(node);
    }

    public int getSymbol(int node) {
        return checkLive().getSymbol(node);
    }

    public long getWeight(int node) {
        return checkLive().getWeight(node);
    }

    public int getLeft(int node) {
        return checkLive().getLeft(node);
    }

    public int getRight(int node) {
        return checkLive().getRight(node);
    }

    /**
     * Total number of nodes, leaves and internal.
     */
    public int getNodeCount() {
        return checkLive().size();
    }

    public boolean isClosed() {
        return closed || arena.isReleased() || arena.generation() != generation;
    }

    private NodeArena checkLive() {
        if (isClosed()) {
            throw new IllegalStateException("Huffman tree belongs to a discarded run");
        }
        return arena;
    }

    @Override
    public void close() {
        if (isClosed()) {
            return;
        }
        closed = true;
        allocator.release(arena);
    }
}
