package com.huffcode.core;

import com.huffcode.error.AllocationFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Recycles fixed-capacity arenas through a free list.
 * <p>
 * Releasing an arena discards all of its nodes in one step and puts the
 * storage back on the free list. Not thread-safe.
 */
public class PooledArenaAllocator implements ArenaAllocator {

    private static final Logger logger = LoggerFactory.getLogger(PooledArenaAllocator.class);

    private final int arenaCapacity;
    private final Deque<NodeArena> freeList;
    private final Set<NodeArena> issued;

    public PooledArenaAllocator() {
        this(HuffmanTreeBuilder.MAX_TREE_NODES);
    }

    public PooledArenaAllocator(int arenaCapacity) {
        if (arenaCapacity < 1) {
            throw new IllegalArgumentException("arenaCapacity must be positive: " + arenaCapacity);
        }
        this.arenaCapacity = arenaCapacity;
        this.freeList = new ArrayDeque<>();
        this.issued = Collections.newSetFromMap(new IdentityHashMap<>());
    }

    @Override
    public NodeArena acquire(int nodeCount) {
        if (nodeCount < 1 || nodeCount > arenaCapacity) {
            throw new AllocationFailureException(
                "Cannot allocate " + nodeCount + " nodes (pool arena capacity " + arenaCapacity + ")");
        }
        NodeArena arena = freeList.poll();
        if (arena == null) {
            logger.debug("Pool empty, allocating new arena of {} nodes", arenaCapacity);
            arena = new NodeArena(arenaCapacity);
        }
        issued.add(arena);
        return arena;
    }

    @Override
    public void release(NodeArena arena) {
        if (!issued.remove(arena)) {
            if (freeList.contains(arena)) {
                throw new IllegalStateException("Arena released twice");
            }
            throw new IllegalArgumentException("Arena was not acquired from this pool");
        }
        arena.recycle();
        freeList.push(arena);
    }

    /**
     * Number of arenas acquired and not yet released.
     */
    public int getOutstandingCount() {
        return issued.size();
    }

    /**
     * Number of arenas waiting on the free list.
     */
    public int getPooledCount() {
        return freeList.size();
    }

    @Override
    public String getAllocatorName() {
        return "pooled";
    }
}
