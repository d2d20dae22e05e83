package com.huffcode.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

/**
 * Unit tests for code table extraction.
 */
class CodeTableBuilderTest {

    private HuffmanTreeBuilder treeBuilder;
    private CodeTableBuilder codeTableBuilder;

    @BeforeEach
    void setUp() {
        treeBuilder = new HuffmanTreeBuilder(new HeapArenaAllocator());
        codeTableBuilder = new CodeTableBuilder();
    }

    private CodeTable buildCodes(long[] frequencies) {
        try (HuffmanTree tree = treeBuilder.build(new FrequencyTable(frequencies))) {
            return codeTableBuilder.build(tree);
        }
    }

    @Test
    void testReferenceCodes() {
        long[] frequencies = new long[256];
        frequencies['a'] = 10;
        frequencies['b'] = 3;
        frequencies['c'] = 3;

        CodeTable codes = buildCodes(frequencies);

        assertEquals(3, codes.size());
        assertEquals("1", codes.get('a').getBits());
        assertEquals("00", codes.get('b').getBits());
        assertEquals("01", codes.get('c').getBits());
        assertNull(codes.get('d'));
    }

    @Test
    void testBuildCodesFromUniformDistribution() {
        long[] frequencies = new long[256];
        for (int i = 0; i < 256; i++) {
            frequencies[i] = 100;
        }

        CodeTable codes = buildCodes(frequencies);

        assertEquals(256, codes.size());
        for (int i = 0; i < 256; i++) {
            assertNotNull(codes.get(i), "Code for symbol " + i + " should not be null");
            assertEquals(8, codes.get(i).getCodeLength());
        }
    }

    @Test
    void testBuildCodesFromSkewedDistribution() {
        long[] frequencies = new long[256];
        frequencies[0] = 1000;  // Very common
        frequencies[1] = 500;
        frequencies[2] = 250;
        for (int i = 3; i < 256; i++) {
            frequencies[i] = 1;  // Rare
        }

        CodeTable codes = buildCodes(frequencies);

        assertEquals(1, codes.get(0).getCodeLength());
        assertTrue(codes.get(0).getCodeLength() <= codes.get(1).getCodeLength());
        assertTrue(codes.get(1).getCodeLength() <= codes.get(255).getCodeLength());
    }

    @Test
    void testSingleSymbolGetsOneBitCode() {
        long[] frequencies = new long[256];
        frequencies[42] = 1000;

        CodeTable codes = buildCodes(frequencies);

        assertEquals(1, codes.size());
        assertEquals("1", codes.get(42).getBits());
    }

    @Test
    void testCodesArePrefixFree() {
        long[] frequencies = new long[256];
        for (int i = 0; i < 256; i++) {
            frequencies[i] = i + 1;
        }

        List<HuffmanCode> codes = buildCodes(frequencies).getCodes();

        assertEquals(256, codes.size());
        for (HuffmanCode a : codes) {
            for (HuffmanCode b : codes) {
                if (a != b) {
                    assertFalse(a.isPrefixOf(b), a.getSymbol() + " is a prefix of " + b.getSymbol());
                }
            }
        }
    }

    @Test
    void testEncodedLength() {
        long[] frequencies = new long[256];
        frequencies['a'] = 10;
        frequencies['b'] = 3;
        frequencies['c'] = 3;

        CodeTable codes = buildCodes(frequencies);

        assertEquals(22, codes.getEncodedLength(new FrequencyTable(frequencies)));
    }

    @Test
    void testCannotExtractFromClosedTree() {
        long[] frequencies = new long[256];
        frequencies['q'] = 1;
        frequencies['r'] = 1;
        HuffmanTree tree = treeBuilder.build(new FrequencyTable(frequencies));
        tree.close();

        assertThrows(IllegalStateException.class, () -> codeTableBuilder.build(tree));
    }
}
