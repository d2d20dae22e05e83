package com.huffcode.error;

/**
 * Thrown when a bit-string cannot be decoded with a given code table.
 */
public class DecodingException extends HuffmanException {

    private final long bitPosition;

    public DecodingException(String message, long bitPosition) {
        super(message + " (bit " + bitPosition + ")");
        this.bitPosition = bitPosition;
    }

    public long getBitPosition() {
        return bitPosition;
    }
}
