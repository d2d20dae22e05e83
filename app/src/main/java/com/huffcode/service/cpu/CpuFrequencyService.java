package com.huffcode.service.cpu;

import com.huffcode.core.FrequencyTable;
import com.huffcode.service.FrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single-pass frequency histogram computation on the calling thread.
 */
public class CpuFrequencyService implements FrequencyService {

    private static final Logger logger = LoggerFactory.getLogger(CpuFrequencyService.class);

    @Override
    public FrequencyTable computeHistogram(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);

        long[] frequencies = new long[FrequencyTable.ALPHABET_SIZE];
        int end = offset + length;

        for (int i = offset; i < end; i++) {
            frequencies[data[i] & 0xFF]++;
        }

        logger.trace("Counted {} bytes", length);
        return new FrequencyTable(frequencies);
    }

    @Override
    public String getServiceName() {
        return "CPU (Sequential)";
    }
}
