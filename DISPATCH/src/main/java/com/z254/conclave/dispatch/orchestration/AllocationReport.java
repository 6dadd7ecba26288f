package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.domain.model.StrategyType;

import java.util.List;
import java.util.Map;

/**
 * Result of one allocation optimization pass.
 */
public record AllocationReport(
        Map<StrategyType, StrategyPerformance> strategyPerformance,
        List<CapacityAdjustment> adjustments) {
}
