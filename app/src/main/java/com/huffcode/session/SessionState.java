package com.huffcode.session;

/**
 * Lifecycle of an {@link EncodingSession}.
 */
public enum SessionState {
    IDLE,
    COUNTING_FREQUENCIES,
    BUILDING_TREE,
    EXTRACTING_CODES,
    ENCODING,
    DONE,
    FAILED;

    /**
     * Whether no further stage will run until the session is reset.
     */
    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
