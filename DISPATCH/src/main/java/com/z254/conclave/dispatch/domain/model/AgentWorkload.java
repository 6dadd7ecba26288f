package com.z254.conclave.dispatch.domain.model;

/**
 * Workload snapshot of one agent.
 */
public record AgentWorkload(
        String agentName,
        int currentLoad,
        int maxCapacity,
        double utilization,
        double availabilityScore,
        double successRate,
        double avgResponseTime) {
}
