package com.huffcode.session;

import com.huffcode.core.ArenaAllocator;
import com.huffcode.core.CodeTable;
import com.huffcode.core.CodeTableBuilder;
import com.huffcode.core.EncodedOutput;
import com.huffcode.core.FrequencyTable;
import com.huffcode.core.HuffmanEncoder;
import com.huffcode.core.HuffmanTree;
import com.huffcode.core.HuffmanTreeBuilder;
import com.huffcode.error.EmptyInputException;
import com.huffcode.model.StageMetrics;
import com.huffcode.service.FrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One encoding run: frequency count, tree, code table and output.
 * <p>
 * A session moves from {@link SessionState#IDLE} through the pipeline stages
 * to {@link SessionState#DONE}, or to {@link SessionState#FAILED} if any stage
 * throws. {@link #reset()} drops everything the run produced and returns the
 * session to {@code IDLE}. The node arena is released as soon as the code
 * table has been extracted, or as soon as a stage fails.
 * <p>
 * Not thread-safe.
 */
public class EncodingSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EncodingSession.class);

    private final FrequencyService frequencyService;
    private final HuffmanTreeBuilder treeBuilder;
    private final CodeTableBuilder codeTableBuilder;
    private final HuffmanEncoder encoder;
    private final boolean metricsEnabled;
    private final StageMetrics stageMetrics;

    private SessionState state;
    private FrequencyTable frequencies;
    private CodeTable codeTable;
    private EncodedOutput output;
    private int nodeCount;

    public EncodingSession(FrequencyService frequencyService, ArenaAllocator allocator,
                           HuffmanEncoder encoder, boolean metricsEnabled) {
        this.frequencyService = frequencyService;
        this.treeBuilder = new HuffmanTreeBuilder(allocator);
        this.codeTableBuilder = new CodeTableBuilder();
        this.encoder = encoder;
        this.metricsEnabled = metricsEnabled;
        this.stageMetrics = new StageMetrics();
        this.state = SessionState.IDLE;
    }

    /**
     * Run the whole pipeline on {@code data}.
     *
     * @param data Input bytes
     * @return Encoded bits
     * @throws EmptyInputException If {@code data} is empty; no tree is built
     * @throws IllegalStateException If the session is not idle
     */
    public EncodedOutput encode(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (state != SessionState.IDLE) {
            throw new IllegalStateException("Session must be reset before encoding again (state " + state + ")");
        }

        try {
            transition(SessionState.COUNTING_FREQUENCIES);
            long start = System.nanoTime();
            frequencies = frequencyService.computeHistogram(data, 0, data.length);
            stageMetrics.recordStage(StageMetrics.Stage.FREQUENCY_COUNT, System.nanoTime() - start);

            if (frequencies.isEmpty()) {
                throw new EmptyInputException("Input is empty");
            }

            transition(SessionState.BUILDING_TREE);
            start = System.nanoTime();
            try (HuffmanTree tree = treeBuilder.build(frequencies)) {
                stageMetrics.recordStage(StageMetrics.Stage.TREE_BUILD, System.nanoTime() - start);
                nodeCount = tree.getNodeCount();

                transition(SessionState.EXTRACTING_CODES);
                start = System.nanoTime();
                codeTable = codeTableBuilder.build(tree);
                stageMetrics.recordStage(StageMetrics.Stage.CODE_EXTRACTION, System.nanoTime() - start);
            }

            transition(SessionState.ENCODING);
            start = System.nanoTime();
            output = encoder.encode(data, codeTable);
            stageMetrics.recordStage(StageMetrics.Stage.ENCODING, System.nanoTime() - start);

            transition(SessionState.DONE);
        } catch (RuntimeException e) {
            logger.debug("Encoding failed in state {}: {}", state, e.getMessage());
            state = SessionState.FAILED;
            throw e;
        }

        if (metricsEnabled && logger.isDebugEnabled()) {
            logger.debug("{} symbols, {} nodes, {} bytes -> {} bits\n{}",
                        codeTable.size(), nodeCount, data.length, output.getBitLength(),
                        stageMetrics.getSummary());
        }
        return output;
    }

    /**
     * Discard frequency table, code table and output and return to {@code IDLE}.
     */
    public void reset() {
        frequencies = null;
        codeTable = null;
        output = null;
        nodeCount = 0;
        stageMetrics.reset();
        state = SessionState.IDLE;
    }

    @Override
    public void close() {
        reset();
    }

    private void transition(SessionState next) {
        logger.trace("{} -> {}", state, next);
        state = next;
    }

    public SessionState getState() {
        return state;
    }

    /**
     * Frequencies of the last run, or null before counting.
     */
    public FrequencyTable getFrequencies() {
        return frequencies;
    }

    /**
     * Code table of the last run, or null before extraction.
     */
    public CodeTable getCodeTable() {
        return codeTable;
    }

    public EncodedOutput getOutput() {
        return output;
    }

    /**
     * Number of tree nodes built by the last run.
     */
    public int getNodeCount() {
        return nodeCount;
    }

    public StageMetrics getStageMetrics() {
        return stageMetrics;
    }
}
