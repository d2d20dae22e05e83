package com.huffcode.core;

/**
 * Source of node arenas for tree construction.
 * <p>
 * Every arena obtained from {@link #acquire(int)} must be handed back through
 * {@link #release(NodeArena)} exactly once. After release the nodes of the
 * arena belong to no run.
 */
public interface ArenaAllocator {

    /**
     * Acquire an empty arena able to hold at least {@code nodeCount} nodes.
     *
     * @param nodeCount Number of nodes the caller will allocate
     * @return Empty arena
     * @throws com.huffcode.error.AllocationFailureException If the request cannot be satisfied
     */
    NodeArena acquire(int nodeCount);

    /**
     * Release an arena and every node in it.
     */
    void release(NodeArena arena);

    /**
     * Get allocator name.
     */
    String getAllocatorName();
}
