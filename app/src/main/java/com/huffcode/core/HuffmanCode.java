package com.huffcode.core;

/**
 * Represents a Huffman code for a symbol, as a string of '0' and '1' characters.
 */
public class HuffmanCode {
    private final int symbol;
    private final String bits;

    public HuffmanCode(int symbol, String bits) {
        if (bits.isEmpty()) {
            throw new IllegalArgumentException("Code for symbol " + symbol + " is empty");
        }
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("Invalid bit '" + c + "' in code " + bits);
            }
        }
        this.symbol = symbol;
        this.bits = bits;
    }

    public int getSymbol() {
        return symbol;
    }

    public int getCodeLength() {
        return bits.length();
    }

    public String getBits() {
        return bits;
    }

    /**
     * Whether this code is a proper or equal prefix of {@code other}.
     */
    public boolean isPrefixOf(HuffmanCode other) {
        return other.bits.startsWith(bits);
    }

    @Override
    public String toString() {
        return bits;
    }
}
