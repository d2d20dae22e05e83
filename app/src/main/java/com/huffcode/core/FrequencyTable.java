package com.huffcode.core;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Occurrence count for each byte value (0-255) of one input.
 */
public class FrequencyTable {

    public static final int ALPHABET_SIZE = 256;

    private final long[] frequencies;

    /**
     * Wrap a histogram produced by a frequency service.
     *
     * @param frequencies Frequency count for each byte value (0-255)
     */
    public FrequencyTable(long[] frequencies) {
        if (frequencies.length != ALPHABET_SIZE) {
            throw new IllegalArgumentException("Frequency array must have 256 elements");
        }
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            if (frequencies[i] < 0) {
                throw new IllegalArgumentException("Negative frequency for symbol " + i);
            }
        }
        this.frequencies = frequencies.clone();
    }

    public long getCount(int symbol) {
        return frequencies[symbol];
    }

    public boolean contains(int symbol) {
        return frequencies[symbol] > 0;
    }

    /**
     * Number of byte values that occur at least once.
     */
    public int getDistinctSymbolCount() {
        int count = 0;
        for (long freq : frequencies) {
            if (freq > 0) count++;
        }
        return count;
    }

    /**
     * Sum of all counts, equal to the length of the counted input.
     */
    public long getTotal() {
        long total = 0;
        for (long freq : frequencies) {
            total += freq;
        }
        return total;
    }

    public boolean isEmpty() {
        return getDistinctSymbolCount() == 0;
    }

    /**
     * Non-zero entries keyed by byte value, in ascending order.
     */
    public Map<Integer, Long> asMap() {
        Map<Integer, Long> map = new TreeMap<>();
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            if (frequencies[i] > 0) {
                map.put(i, frequencies[i]);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "FrequencyTable" + asMap();
    }
}
