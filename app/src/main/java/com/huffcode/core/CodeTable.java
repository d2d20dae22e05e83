package com.huffcode.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Symbol to code mapping with constant-time lookup by byte value.
 */
public class CodeTable {

    private final HuffmanCode[] codes;
    private final int size;

    CodeTable(HuffmanCode[] codes) {
        if (codes.length != FrequencyTable.ALPHABET_SIZE) {
            throw new IllegalArgumentException("Code array must have 256 elements");
        }
        this.codes = codes.clone();
        int count = 0;
        for (HuffmanCode code : this.codes) {
            if (code != null) count++;
        }
        this.size = count;
    }

    /**
     * Code for a byte value, or null when the symbol has none.
     */
    public HuffmanCode get(int symbol) {
        return codes[symbol];
    }

    public boolean contains(int symbol) {
        return codes[symbol] != null;
    }

    /**
     * Number of symbols with a code.
     */
    public int size() {
        return size;
    }

    /**
     * All codes in ascending symbol order.
     */
    public List<HuffmanCode> getCodes() {
        List<HuffmanCode> list = new ArrayList<>(size);
        for (HuffmanCode code : codes) {
            if (code != null) list.add(code);
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Length in bits of the encoding of an input with the given counts.
     *
     * @throws IllegalArgumentException If a counted symbol has no code
     */
    public long getEncodedLength(FrequencyTable frequencies) {
        long total = 0;
        for (int symbol = 0; symbol < FrequencyTable.ALPHABET_SIZE; symbol++) {
            long count = frequencies.getCount(symbol);
            if (count == 0) continue;
            if (codes[symbol] == null) {
                throw new IllegalArgumentException("Symbol " + symbol + " has no code");
            }
            total += count * codes[symbol].getCodeLength();
        }
        return total;
    }

    /**
     * Codes keyed by byte value, ascending.
     */
    public Map<Integer, String> asMap() {
        Map<Integer, String> map = new LinkedHashMap<>();
        for (HuffmanCode code : codes) {
            if (code != null) map.put(code.getSymbol(), code.getBits());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "CodeTable" + asMap();
    }
}
