package com.z254.conclave.dispatch.orchestration;

/**
 * A change to an agent's concurrency ceiling.
 */
public record CapacityAdjustment(String agentName, int previousCapacity, int newCapacity, String reason) {
}
