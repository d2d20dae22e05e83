package com.huffcode.core;

import com.huffcode.error.DecodingException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Turns a bit-string back into bytes using a code table.
 * <p>
 * The table's codes are loaded into a binary trie; decoding walks the trie
 * one bit at a time and emits a symbol at each leaf.
 */
public class HuffmanDecoder {

    private static final int NONE = -1;

    // Trie node i has children next[2i] ('0') and next[2i + 1] ('1')
    private int[] next;
    private int[] symbols;
    private int nodeCount;
    private final int maxCodeLength;

    public HuffmanDecoder(CodeTable table) {
        if (table.size() == 0) {
            throw new IllegalArgumentException("Code table is empty");
        }
        this.next = new int[64];
        this.symbols = new int[32];
        Arrays.fill(next, NONE);
        Arrays.fill(symbols, NONE);
        this.nodeCount = 1;

        int maxLen = 0;
        for (HuffmanCode code : table.getCodes()) {
            insert(code);
            maxLen = Math.max(maxLen, code.getCodeLength());
        }
        this.maxCodeLength = maxLen;
    }

    private void insert(HuffmanCode code) {
        String bits = code.getBits();
        int node = 0;
        for (int i = 0; i < bits.length(); i++) {
            if (symbols[node] != NONE) {
                throw new IllegalArgumentException("Code table is not prefix-free at symbol " + code.getSymbol());
            }
            int slot = 2 * node + (bits.charAt(i) - '0');
            if (next[slot] == NONE) {
                next[slot] = newNode();
            }
            node = next[slot];
        }
        if (symbols[node] != NONE || next[2 * node] != NONE || next[2 * node + 1] != NONE) {
            throw new IllegalArgumentException("Code table is not prefix-free at symbol " + code.getSymbol());
        }
        symbols[node] = code.getSymbol();
    }

    private int newNode() {
        if (nodeCount == symbols.length) {
            int oldNext = next.length;
            symbols = Arrays.copyOf(symbols, symbols.length * 2);
            next = Arrays.copyOf(next, next.length * 2);
            Arrays.fill(symbols, nodeCount, symbols.length, NONE);
            Arrays.fill(next, oldNext, next.length, NONE);
        }
        return nodeCount++;
    }

    /**
     * Decode a complete bit-string.
     *
     * @throws DecodingException If the bits are not a concatenation of table codes
     */
    public byte[] decode(CharSequence bits) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(16, bits.length() / Math.max(1, maxCodeLength)));
        int node = 0;
        int codeStart = 0;

        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new DecodingException("Invalid character '" + c + "'", i);
            }
            node = next[2 * node + (c - '0')];
            if (node == NONE) {
                throw new DecodingException("No code matches bits starting", codeStart);
            }
            if (symbols[node] != NONE) {
                out.write(symbols[node]);
                node = 0;
                codeStart = i + 1;
            }
        }

        if (node != 0) {
            throw new DecodingException("Truncated code at end of input", codeStart);
        }
        return out.toByteArray();
    }

    /**
     * Decode {@code output} with {@code table}.
     */
    public static byte[] decode(EncodedOutput output, CodeTable table) {
        return new HuffmanDecoder(table).decode(output.getBits());
    }

    public int getMaxCodeLength() {
        return maxCodeLength;
    }
}
