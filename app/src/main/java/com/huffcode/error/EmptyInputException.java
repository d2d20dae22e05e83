package com.huffcode.error;

/**
 * Thrown when the input (and therefore its frequency table) is empty.
 * No tree can be built from zero symbols.
 */
public class EmptyInputException extends HuffmanException {

    public EmptyInputException(String message) {
        super(message);
    }
}
