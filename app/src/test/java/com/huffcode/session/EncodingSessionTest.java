package com.huffcode.session;

import com.huffcode.core.EncodedOutput;
import com.huffcode.core.HeapArenaAllocator;
import com.huffcode.core.HuffmanEncoder;
import com.huffcode.core.PooledArenaAllocator;
import com.huffcode.core.TrackingArenaAllocator;
import com.huffcode.error.AllocationFailureException;
import com.huffcode.error.EmptyInputException;
import com.huffcode.model.StageMetrics;
import com.huffcode.service.cpu.CpuFrequencyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Tests for the session lifecycle and resource handling.
 */
class EncodingSessionTest {

    private TrackingArenaAllocator allocator;
    private EncodingSession session;

    @BeforeEach
    void setUp() {
        allocator = new TrackingArenaAllocator(new PooledArenaAllocator());
        session = new EncodingSession(new CpuFrequencyService(), allocator, new HuffmanEncoder(), true);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void testEncodeReferenceVector() {
        assertEquals(SessionState.IDLE, session.getState());

        EncodedOutput output = session.encode(ascii("abcaabbaaaccaaaa"));

        assertEquals("1000111000011101011111", output.getBits());
        assertEquals(SessionState.DONE, session.getState());
        assertSame(output, session.getOutput());
        assertEquals(5, session.getNodeCount());
        assertEquals(3, session.getCodeTable().size());
        assertEquals(16, session.getFrequencies().getTotal());
    }

    @Test
    void testArenaReleasedOnceCodesExtracted() {
        session.encode(ascii("hello huffman"));

        assertEquals(1, allocator.getAcquiredCount());
        assertEquals(0, allocator.getOutstandingCount());
    }

    @Test
    void testEmptyInputFailsBeforeTreeConstruction() {
        assertThrows(EmptyInputException.class, () -> session.encode(new byte[0]));

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals(0, allocator.getAcquiredCount());
        assertNull(session.getCodeTable());
    }

    @Test
    void testEncodeRequiresIdleSession() {
        session.encode(ascii("abc"));

        assertThrows(IllegalStateException.class, () -> session.encode(ascii("abc")));

        session.reset();
        assertEquals(SessionState.IDLE, session.getState());
        assertEquals("1", session.encode(ascii("q")).getBits());
    }

    @Test
    void testFailedSessionCanBeReset() {
        assertThrows(EmptyInputException.class, () -> session.encode(new byte[0]));
        assertThrows(IllegalStateException.class, () -> session.encode(ascii("abc")));

        session.reset();
        session.encode(ascii("abc"));
        assertEquals(SessionState.DONE, session.getState());
    }

    @Test
    void testResetDropsRunState() {
        session.encode(ascii("mississippi"));
        session.reset();

        assertEquals(SessionState.IDLE, session.getState());
        assertNull(session.getFrequencies());
        assertNull(session.getCodeTable());
        assertNull(session.getOutput());
        assertEquals(0, session.getNodeCount());
        assertEquals(0, session.getStageMetrics().getStageCount(StageMetrics.Stage.ENCODING));
    }

    @Test
    void testRepeatedCyclesLeaveNothingOutstanding() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            byte[] data = new byte[1 + random.nextInt(512)];
            random.nextBytes(data);

            EncodedOutput output = session.encode(data);

            assertTrue(output.getBitLength() >= data.length);
            assertEquals(0, allocator.getOutstandingCount(), "run " + run);
            session.reset();
        }
        assertEquals(200, allocator.getAcquiredCount());
        assertEquals(200, allocator.getReleasedCount());
    }

    @Test
    void testArenaLimitFailure() {
        TrackingArenaAllocator limited = new TrackingArenaAllocator(new HeapArenaAllocator(3));
        EncodingSession small = new EncodingSession(new CpuFrequencyService(), limited, new HuffmanEncoder(), false);

        assertThrows(AllocationFailureException.class, () -> small.encode(ascii("abc")));

        assertEquals(SessionState.FAILED, small.getState());
        assertEquals(0, limited.getOutstandingCount());

        // two symbols fit in three nodes
        small.reset();
        assertEquals("0110", small.encode(ascii("abba")).getBits());
    }

    @Test
    void testOutputLimitFailureReleasesArena() {
        EncodingSession limited = new EncodingSession(new CpuFrequencyService(), allocator, new HuffmanEncoder(4), false);

        assertThrows(AllocationFailureException.class, () -> limited.encode(ascii("abcabc")));

        assertEquals(SessionState.FAILED, limited.getState());
        assertNotNull(limited.getCodeTable());
        assertEquals(0, allocator.getOutstandingCount());
    }

    @Test
    void testStageMetricsRecorded() {
        session.encode(ascii("stage metrics"));

        StageMetrics metrics = session.getStageMetrics();
        for (StageMetrics.Stage stage : StageMetrics.Stage.values()) {
            assertEquals(1, metrics.getStageCount(stage), stage.name());
        }
    }

    @Test
    void testCloseResetsSession() {
        try (EncodingSession s = new EncodingSession(new CpuFrequencyService(), allocator, new HuffmanEncoder(), false)) {
            s.encode(ascii("close"));
        }
        assertEquals(0, allocator.getOutstandingCount());
    }

    @Test
    void testNullInputRejected() {
        assertThrows(NullPointerException.class, () -> session.encode(null));
        assertEquals(SessionState.IDLE, session.getState());
    }
}
