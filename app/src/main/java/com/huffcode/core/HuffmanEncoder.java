package com.huffcode.core;

import com.huffcode.error.AllocationFailureException;
import com.huffcode.error.MissingCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces every input byte by its code, in input order.
 */
public class HuffmanEncoder {

    private static final Logger logger = LoggerFactory.getLogger(HuffmanEncoder.class);

    /**
     * Largest character count a {@link StringBuilder} can reliably hold.
     */
    public static final long MAX_OUTPUT_BITS = Integer.MAX_VALUE - 8;

    private final long maxOutputBits;

    public HuffmanEncoder() {
        this(MAX_OUTPUT_BITS);
    }

    public HuffmanEncoder(long maxOutputBits) {
        if (maxOutputBits < 1 || maxOutputBits > MAX_OUTPUT_BITS) {
            throw new IllegalArgumentException("maxOutputBits out of range: " + maxOutputBits);
        }
        this.maxOutputBits = maxOutputBits;
    }

    /**
     * Encode an input with a table built from the same input.
     *
     * @param data Input bytes
     * @param table Code table
     * @return Concatenated codes
     * @throws MissingCodeException If a byte has no code
     * @throws AllocationFailureException If the output exceeds the size limit or cannot be allocated
     */
    public EncodedOutput encode(byte[] data, CodeTable table) {
        // Size the output exactly, failing on the first byte without a code
        long totalBits = 0;
        for (int i = 0; i < data.length; i++) {
            totalBits += lookup(table, data[i], i).getCodeLength();
        }

        if (totalBits > maxOutputBits) {
            throw new AllocationFailureException(
                "Encoded output of " + totalBits + " bits exceeds limit of " + maxOutputBits);
        }

        StringBuilder out;
        try {
            out = new StringBuilder((int) totalBits);
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException("Cannot allocate output buffer of " + totalBits + " bits", e);
        }

        for (int i = 0; i < data.length; i++) {
            out.append(lookup(table, data[i], i).getBits());
        }

        logger.debug("Encoded {} bytes into {} bits", data.length, totalBits);
        return new EncodedOutput(out.toString(), data.length);
    }

    private static HuffmanCode lookup(CodeTable table, byte value, int offset) {
        int symbol = value & 0xFF;
        HuffmanCode code = table.get(symbol);
        if (code == null) {
            throw new MissingCodeException(symbol, offset);
        }
        return code;
    }
}
