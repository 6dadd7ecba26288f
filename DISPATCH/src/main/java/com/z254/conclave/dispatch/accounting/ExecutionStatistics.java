package com.z254.conclave.dispatch.accounting;

import com.z254.conclave.dispatch.hook.HookType;

import java.util.Map;

/**
 * Point-in-time execution statistics of the interceptor.
 */
public record ExecutionStatistics(
        Map<String, ToolExecutionCounts> executionCounts,
        int activeExecutions,
        int totalToolsMonitored,
        Map<String, Long> errorFrequencies,
        Map<HookType, Integer> hookCounts,
        Map<String, Double> successRates,
        Map<String, PerformanceStats> performance) {
}
