package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.domain.model.StrategyType;

/**
 * How often a strategy completed the tasks it was given.
 */
public record StrategyPerformance(StrategyType strategy, int total, int completed) {

    public double successRate() {
        return total > 0 ? (double) completed / total : 0.0;
    }
}
