package com.z254.conclave.dispatch.accounting;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of recorded error patterns.
 *
 * @param errorFrequencies occurrences per {@code tool:errorType} key
 * @param patterns summary per key
 * @param topErrors most frequent keys, highest first
 * @param recentErrors newest errors across all keys, newest first
 */
public record ErrorAnalysis(
        Map<String, Long> errorFrequencies,
        Map<String, PatternSummary> patterns,
        List<ErrorFrequency> topErrors,
        List<RecentError> recentErrors) {

    public record PatternSummary(
            int totalOccurrences,
            int recentOccurrences,
            Duration avgDuration,
            double avgRetryCount,
            Instant lastOccurrence) {
    }

    public record ErrorFrequency(String patternKey, long count) {
    }

    public record RecentError(String patternKey, Instant timestamp, String error, int retryCount,
                              Duration duration) {
    }
}
