package com.huffcode.error;

/**
 * Thrown when the encoder meets a byte that has no entry in the code table.
 * The table is always built from the same input, so this means the tree and
 * the table disagree.
 */
public class MissingCodeException extends HuffmanException {

    private final int symbol;
    private final long offset;

    public MissingCodeException(int symbol, long offset) {
        super(String.format("No code for byte 0x%02x at offset %d", symbol, offset));
        this.symbol = symbol;
        this.offset = offset;
    }

    public int getSymbol() {
        return symbol;
    }

    public long getOffset() {
        return offset;
    }
}
