package com.z254.conclave.dispatch.accounting;

/**
 * Execution counters of one tool.
 */
public record ToolExecutionCounts(long total, long successful, long failed, long cacheHits, long retried) {

    public double successRate() {
        return total > 0 ? (double) successful / total : 0.0;
    }
}
