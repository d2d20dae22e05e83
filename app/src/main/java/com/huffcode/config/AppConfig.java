package com.huffcode.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Application configuration wrapper.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private final Config config;

    public AppConfig() {
        this(ConfigFactory.load());
    }

    public AppConfig(Config config) {
        this.config = config.getConfig("huffcode");
        logger.debug("Loaded configuration: arena={}, max-nodes={}, max-output-bits={}",
                    getArenaStrategy(), getArenaMaxNodes(), getMaxOutputBits());
    }

    /**
     * How node arenas are obtained for each run.
     */
    public enum ArenaStrategy {
        HEAP,
        POOLED
    }

    // Arena settings
    public ArenaStrategy getArenaStrategy() {
        String value = config.getString("arena.strategy");
        try {
            return ArenaStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), "arena.strategy",
                "expected 'heap' or 'pooled' but got '" + value + "'");
        }
    }

    public int getArenaMaxNodes() {
        int maxNodes = config.getInt("arena.max-nodes");
        if (maxNodes < 1) {
            throw new ConfigException.BadValue(config.origin(), "arena.max-nodes",
                "must be positive but was " + maxNodes);
        }
        return maxNodes;
    }

    // Encoder settings
    public long getMaxOutputBits() {
        long maxBits = config.getLong("encoder.max-output-bits");
        if (maxBits < 1) {
            throw new ConfigException.BadValue(config.origin(), "encoder.max-output-bits",
                "must be positive but was " + maxBits);
        }
        return maxBits;
    }

    // Metrics settings
    public boolean isMetricsEnabled() {
        return config.getBoolean("metrics.enabled");
    }
}
