package com.huffcode.service;

import com.huffcode.core.ArenaAllocator;
import com.huffcode.core.EncodedOutput;
import com.huffcode.core.HuffmanEncoder;
import com.huffcode.service.cpu.CpuFrequencyService;
import com.huffcode.session.EncodingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encoding service backed by a shared arena allocator.
 * <p>
 * Sessions created by one service share its allocator and must be used
 * from one thread at a time.
 */
public class HuffmanEncodingService implements EncodingService {

    private static final Logger logger = LoggerFactory.getLogger(HuffmanEncodingService.class);

    private final FrequencyService frequencyService;
    private final ArenaAllocator allocator;
    private final HuffmanEncoder encoder;
    private final boolean metricsEnabled;

    public HuffmanEncodingService(ArenaAllocator allocator) {
        this(new CpuFrequencyService(), allocator, new HuffmanEncoder(), false);
    }

    public HuffmanEncodingService(FrequencyService frequencyService, ArenaAllocator allocator,
                                  HuffmanEncoder encoder, boolean metricsEnabled) {
        this.frequencyService = frequencyService;
        this.allocator = allocator;
        this.encoder = encoder;
        this.metricsEnabled = metricsEnabled;

        logger.info("Initialized encoding service with {} arenas and {} frequency counting",
                   allocator.getAllocatorName(), frequencyService.getServiceName());
    }

    @Override
    public EncodingSession createSession() {
        return new EncodingSession(frequencyService, allocator, encoder, metricsEnabled);
    }

    @Override
    public EncodedOutput encode(EncodingSession session, byte[] data) {
        return session.encode(data);
    }

    @Override
    public void resetOrDestroy(EncodingSession session) {
        session.reset();
    }

    public ArenaAllocator getAllocator() {
        return allocator;
    }

    @Override
    public String getServiceName() {
        return "Huffman Encoding (" + allocator.getAllocatorName() + " arenas)";
    }
}
