package com.huffcode.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tracks timing metrics for the stages of an encoding run.
 */
public class StageMetrics {

    public enum Stage {
        FREQUENCY_COUNT("Frequency Count"),
        TREE_BUILD("Huffman Tree Build"),
        CODE_EXTRACTION("Code Extraction"),
        ENCODING("Encoding");

        private final String displayName;

        Stage(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final Map<Stage, Long> stageTimes; // in nanoseconds
    private final Map<Stage, Integer> stageCounts;

    public StageMetrics() {
        this.stageTimes = new EnumMap<>(Stage.class);
        this.stageCounts = new EnumMap<>(Stage.class);
    }

    /**
     * Record time taken for a stage.
     */
    public void recordStage(Stage stage, long nanoTime) {
        stageTimes.merge(stage, nanoTime, Long::sum);
        stageCounts.merge(stage, 1, Integer::sum);
    }

    /**
     * Get total time for a stage in milliseconds.
     */
    public double getStageTimeMs(Stage stage) {
        return stageTimes.getOrDefault(stage, 0L) / 1_000_000.0;
    }

    /**
     * Get number of times a stage was executed.
     */
    public int getStageCount(Stage stage) {
        return stageCounts.getOrDefault(stage, 0);
    }

    /**
     * Get percentage of total time spent in this stage.
     */
    public double getStagePercentage(Stage stage) {
        long stageTime = stageTimes.getOrDefault(stage, 0L);
        long totalTime = stageTimes.values().stream().mapToLong(Long::longValue).sum();
        if (totalTime == 0) return 0;
        return (stageTime * 100.0) / totalTime;
    }

    /**
     * Get formatted summary of all recorded stages.
     */
    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stage Performance Breakdown:\n");

        for (Stage stage : Stage.values()) {
            if (stageTimes.containsKey(stage)) {
                sb.append(String.format("%-20s: %8.3f ms (%5.1f%%)%n",
                    stage.getDisplayName(),
                    getStageTimeMs(stage),
                    getStagePercentage(stage)));
            }
        }

        return sb.toString();
    }

    /**
     * Reset all metrics.
     */
    public void reset() {
        stageTimes.clear();
        stageCounts.clear();
    }
}
