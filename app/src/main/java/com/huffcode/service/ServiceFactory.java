package com.huffcode.service;

import com.huffcode.config.AppConfig;
import com.huffcode.core.ArenaAllocator;
import com.huffcode.core.HeapArenaAllocator;
import com.huffcode.core.HuffmanEncoder;
import com.huffcode.core.PooledArenaAllocator;
import com.huffcode.service.cpu.CpuFrequencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating encoding services based on configuration.
 */
public class ServiceFactory {

    private static final Logger logger = LoggerFactory.getLogger(ServiceFactory.class);

    /**
     * Create encoding service based on configuration.
     */
    public static HuffmanEncodingService createEncodingService(AppConfig config) {
        return new HuffmanEncodingService(
            createFrequencyService(config),
            createArenaAllocator(config),
            new HuffmanEncoder(Math.min(config.getMaxOutputBits(), HuffmanEncoder.MAX_OUTPUT_BITS)),
            config.isMetricsEnabled());
    }

    /**
     * Create arena allocator based on configuration.
     */
    public static ArenaAllocator createArenaAllocator(AppConfig config) {
        int maxNodes = config.getArenaMaxNodes();
        switch (config.getArenaStrategy()) {
            case POOLED:
                logger.debug("Using pooled arenas of {} nodes", maxNodes);
                return new PooledArenaAllocator(maxNodes);
            case HEAP:
            default:
                logger.debug("Using heap arenas, limit {} nodes", maxNodes);
                return new HeapArenaAllocator(maxNodes);
        }
    }

    /**
     * Create frequency service based on configuration.
     */
    public static FrequencyService createFrequencyService(AppConfig config) {
        return new CpuFrequencyService();
    }
}
