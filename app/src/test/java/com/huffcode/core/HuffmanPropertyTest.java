package com.huffcode.core;

import com.huffcode.service.cpu.CpuFrequencyService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

/**
 * Property-based tests for Huffman coding using jqwik.
 */
class HuffmanPropertyTest {

    private final CpuFrequencyService frequencyService = new CpuFrequencyService();
    private final HuffmanTreeBuilder treeBuilder = new HuffmanTreeBuilder(new HeapArenaAllocator());
    private final CodeTableBuilder codeTableBuilder = new CodeTableBuilder();
    private final HuffmanEncoder encoder = new HuffmanEncoder();

    private CodeTable buildCodes(FrequencyTable frequencies) {
        try (HuffmanTree tree = treeBuilder.build(frequencies)) {
            return codeTableBuilder.build(tree);
        }
    }

    private FrequencyTable count(byte[] data) {
        return frequencyService.computeHistogram(data, 0, data.length);
    }

    @Property
    void codesShouldBePrefixFree(@ForAll("inputs") byte[] data) {
        List<HuffmanCode> codes = buildCodes(count(data)).getCodes();

        for (HuffmanCode a : codes) {
            for (HuffmanCode b : codes) {
                if (a != b) {
                    assertFalse(a.isPrefixOf(b),
                        "Code " + a + " of " + a.getSymbol() + " prefixes " + b + " of " + b.getSymbol());
                }
            }
        }
    }

    @Property
    void everyInputSymbolShouldHaveExactlyOneCode(@ForAll("inputs") byte[] data) {
        FrequencyTable frequencies = count(data);
        CodeTable codes = buildCodes(frequencies);

        assertEquals(frequencies.getDistinctSymbolCount(), codes.size());
        for (int symbol = 0; symbol < 256; symbol++) {
            assertEquals(frequencies.contains(symbol), codes.contains(symbol), "Symbol " + symbol);
        }
    }

    @Property
    void outputLengthShouldMatchFrequencyWeightedCodeLengths(@ForAll("inputs") byte[] data) {
        FrequencyTable frequencies = count(data);
        CodeTable codes = buildCodes(frequencies);

        long expected = 0;
        for (HuffmanCode code : codes.getCodes()) {
            expected += frequencies.getCount(code.getSymbol()) * code.getCodeLength();
        }

        assertEquals(expected, encoder.encode(data, codes).getBitLength());
    }

    @Property
    void frequenciesShouldSumToInputLength(@ForAll("inputs") byte[] data) {
        assertEquals(data.length, count(data).getTotal());
    }

    @Property
    void treeShouldHoldTwoKMinusOneNodes(@ForAll("inputs") byte[] data) {
        FrequencyTable frequencies = count(data);

        try (HuffmanTree tree = treeBuilder.build(frequencies)) {
            assertEquals(2 * frequencies.getDistinctSymbolCount() - 1, tree.getNodeCount());
        }
    }

    @Property
    void repeatedByteShouldEncodeToOnes(@ForAll byte value, @ForAll @IntRange(min = 1, max = 500) int length) {
        byte[] data = new byte[length];
        Arrays.fill(data, value);

        assertEquals("1".repeat(length), encoder.encode(data, buildCodes(count(data))).getBits());
    }

    @Property
    void frequentSymbolsShouldHaveShorterCodes(@ForAll("inputs") byte[] data) {
        FrequencyTable frequencies = count(data);
        CodeTable codes = buildCodes(frequencies);

        for (HuffmanCode a : codes.getCodes()) {
            for (HuffmanCode b : codes.getCodes()) {
                if (frequencies.getCount(a.getSymbol()) > frequencies.getCount(b.getSymbol())) {
                    assertTrue(a.getCodeLength() <= b.getCodeLength(),
                        "More frequent symbols should have shorter or equal length codes");
                }
            }
        }
    }

    @Property
    void decodingShouldRestoreInput(@ForAll("inputs") byte[] data) {
        CodeTable codes = buildCodes(count(data));

        assertArrayEquals(data, HuffmanDecoder.decode(encoder.encode(data, codes), codes));
    }

    @Property
    void encodingShouldBeDeterministic(@ForAll("inputs") byte[] data) {
        String first = encoder.encode(data, buildCodes(count(data))).getBits();
        String second = encoder.encode(data, buildCodes(count(data.clone()))).getBits();

        assertEquals(first, second);
    }

    @Provide
    Arbitrary<byte[]> inputs() {
        Arbitrary<List<Byte>> anyBytes = Arbitraries.bytes().list().ofMinSize(1).ofMaxSize(2000);
        Arbitrary<List<Byte>> smallAlphabet = Arbitraries.bytes().between((byte) 'a', (byte) 'f')
            .list().ofMinSize(1).ofMaxSize(300);
        return Arbitraries.oneOf(anyBytes, smallAlphabet).map(HuffmanPropertyTest::toArray);
    }

    private static byte[] toArray(List<Byte> list) {
        byte[] data = new byte[list.size()];
        for (int i = 0; i < data.length; i++) {
            data[i] = list.get(i);
        }
        return data;
    }
}
