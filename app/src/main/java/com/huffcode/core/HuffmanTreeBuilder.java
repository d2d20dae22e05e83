package com.huffcode.core;

import com.huffcode.error.AllocationFailureException;
import com.huffcode.error.EmptyInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a Huffman tree from a frequency table.
 */
public class HuffmanTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(HuffmanTreeBuilder.class);

    /**
     * Node count of a tree over the full byte alphabet: 2 * 256 - 1.
     */
    public static final int MAX_TREE_NODES = 2 * FrequencyTable.ALPHABET_SIZE - 1;

    private final ArenaAllocator allocator;

    public HuffmanTreeBuilder(ArenaAllocator allocator) {
        this.allocator = allocator;
    }

    /**
     * Build the tree.
     * <p>
     * One leaf per distinct symbol is queued in ascending byte order; the two
     * lowest nodes are then repeatedly combined (first extracted on the left)
     * until one node remains. A single symbol yields a one-leaf tree.
     *
     * @param frequencies Symbol counts of the input
     * @return Tree holding exactly {@code 2k - 1} nodes for {@code k} distinct symbols
     * @throws EmptyInputException If no symbol has a non-zero count
     */
    public HuffmanTree build(FrequencyTable frequencies) {
        int numSymbols = frequencies.getDistinctSymbolCount();
        if (numSymbols == 0) {
            throw new EmptyInputException("Cannot build a Huffman tree from an empty frequency table");
        }

        NodeArena arena = allocator.acquire(2 * numSymbols - 1);
        boolean built = false;
        try {
            MinPriorityQueue queue = new MinPriorityQueue(arena, numSymbols);

            // Create leaf nodes
            for (int symbol = 0; symbol < FrequencyTable.ALPHABET_SIZE; symbol++) {
                if (frequencies.contains(symbol)) {
                    queue.insert(arena.allocateLeaf(symbol, frequencies.getCount(symbol)));
                }
            }

            // Build tree
            while (queue.size() > 1) {
                int left = queue.extractMin();
                int right = queue.extractMin();
                queue.insert(arena.allocateInternal(left, right));
            }

            int root = queue.extractMin();
            logger.debug("Built Huffman tree: {} symbols, {} nodes, root weight {}",
                        numSymbols, arena.size(), arena.getWeight(root));
            HuffmanTree tree = new HuffmanTree(allocator, arena, root);
            built = true;
            return tree;
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException("Cannot build tree of " + numSymbols + " symbols", e);
        } finally {
            if (!built) {
                allocator.release(arena);
            }
        }
    }
}
