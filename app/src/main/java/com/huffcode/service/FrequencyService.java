package com.huffcode.service;

import com.huffcode.core.FrequencyTable;

/**
 * Service for computing byte frequency histograms.
 */
public interface FrequencyService {

    /**
     * Compute frequency histogram for a byte array.
     *
     * @param data Input data
     * @param offset Starting offset
     * @param length Number of bytes to process
     * @return Frequency table over the 256 byte values
     */
    FrequencyTable computeHistogram(byte[] data, int offset, int length);

    /**
     * Get service name.
     */
    String getServiceName();
}
