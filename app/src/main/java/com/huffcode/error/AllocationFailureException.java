package com.huffcode.error;

/**
 * Thrown when a node arena or an output buffer cannot be allocated.
 */
public class AllocationFailureException extends HuffmanException {

    public AllocationFailureException(String message) {
        super(message);
    }

    public AllocationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
