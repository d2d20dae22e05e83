package com.huffcode.core;

/**
 * Encoded form of an input: one '0' or '1' character per bit, no delimiters.
 */
public class EncodedOutput {

    private final String bits;
    private final long inputLength;

    public EncodedOutput(String bits, long inputLength) {
        this.bits = bits;
        this.inputLength = inputLength;
    }

    public String getBits() {
        return bits;
    }

    public int getBitLength() {
        return bits.length();
    }

    /**
     * Number of input bytes the bits were produced from.
     */
    public long getInputLength() {
        return inputLength;
    }

    /**
     * Bits per input byte.
     */
    public double getBitsPerSymbol() {
        if (inputLength == 0) return 0;
        return (double) bits.length() / inputLength;
    }

    @Override
    public String toString() {
        return bits;
    }
}
