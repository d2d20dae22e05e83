package com.huffcode.core;

/**
 * Extracts the code table from a Huffman tree.
 * <p>
 * Each code is the path from the root to its leaf, '0' for a left branch
 * and '1' for a right branch. When the root itself is a leaf the path is
 * empty and the symbol gets the one-bit code "1".
 */
public class CodeTableBuilder {

    static final String SINGLE_SYMBOL_CODE = "1";

    public CodeTable build(HuffmanTree tree) {
        HuffmanCode[] codes = new HuffmanCode[FrequencyTable.ALPHABET_SIZE];
        int root = tree.getRoot();

        if (tree.isLeaf(root)) {
            int symbol = tree.getSymbol(root);
            codes[symbol] = new HuffmanCode(symbol, SINGLE_SYMBOL_CODE);
        } else {
            extractCodes(tree, root, new StringBuilder(), codes);
        }

        return new CodeTable(codes);
    }

    /**
     * Recursively walk the tree, recording the path at each leaf.
     */
    private static void extractCodes(HuffmanTree tree, int node, StringBuilder path, HuffmanCode[] codes) {
        if (tree.isLeaf(node)) {
            int symbol = tree.getSymbol(node);
            codes[symbol] = new HuffmanCode(symbol, path.toString());
            return;
        }

        path.append('0');
        extractCodes(tree, tree.getLeft(node), path, codes);
        path.setCharAt(path.length() - 1, '1');
        extractCodes(tree, tree.getRight(node), path, codes);
        path.setLength(path.length() - 1);
    }
}
