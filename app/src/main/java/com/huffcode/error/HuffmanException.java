package com.huffcode.error;

/**
 * Base class for failures raised by the Huffman encoding pipeline.
 */
public class HuffmanException extends RuntimeException {

    public HuffmanException(String message) {
        super(message);
    }

    public HuffmanException(String message, Throwable cause) {
        super(message, cause);
    }
}
