package com.huffcode.core;

import com.huffcode.error.AllocationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates a right-sized arena for every run and drops it on release.
 */
public class HeapArenaAllocator implements ArenaAllocator {

    private static final Logger logger = LoggerFactory.getLogger(HeapArenaAllocator.class);

    private final int maxNodes;

    public HeapArenaAllocator() {
        this(HuffmanTreeBuilder.MAX_TREE_NODES);
    }

    public HeapArenaAllocator(int maxNodes) {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    @Override
    public NodeArena acquire(int nodeCount) {
        if (nodeCount < 1 || nodeCount > maxNodes) {
            throw new AllocationFailureException(
                "Cannot allocate " + nodeCount + " nodes (limit " + maxNodes + ")");
        }
        logger.trace("Allocating arena for {} nodes", nodeCount);
        return new NodeArena(nodeCount);
    }

    @Override
    public void release(NodeArena arena) {
        arena.release();
    }

    @Override
    public String getAllocatorName() {
        return "heap";
    }
}
