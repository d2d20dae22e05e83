package com.huffcode.service;

import com.huffcode.core.EncodedOutput;
import com.huffcode.session.EncodingSession;

/**
 * Service interface for Huffman encoding operations.
 */
public interface EncodingService {

    /**
     * Create an idle session.
     */
    EncodingSession createSession();

    /**
     * Encode bytes in a session.
     *
     * @param session Idle session
     * @param data Input bytes
     * @return One '0' or '1' character per emitted bit
     * @throws com.huffcode.error.EmptyInputException If {@code data} is empty
     */
    EncodedOutput encode(EncodingSession session, byte[] data);

    /**
     * Release everything the session holds and return it to idle.
     */
    void resetOrDestroy(EncodingSession session);

    /**
     * Get service name.
     */
    String getServiceName();
}
