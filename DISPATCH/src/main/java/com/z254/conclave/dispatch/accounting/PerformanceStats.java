package com.z254.conclave.dispatch.accounting;

import java.time.Duration;

/**
 * Aggregates over a tool's recent execution durations.
 */
public record PerformanceStats(Duration average, Duration min, Duration max, int count) {
}
