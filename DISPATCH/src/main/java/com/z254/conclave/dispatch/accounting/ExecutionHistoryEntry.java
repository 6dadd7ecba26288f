package com.z254.conclave.dispatch.accounting;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Serialized summary of one completed execution, kept for replay lookups.
 */
public record ExecutionHistoryEntry(
        String toolName,
        String executionId,
        Instant timestamp,
        Map<String, Object> input,
        Map<String, Object> context,
        boolean success,
        Duration duration,
        String resultSummary) {
}
