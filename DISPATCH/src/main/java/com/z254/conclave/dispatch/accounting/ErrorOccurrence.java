package com.z254.conclave.dispatch.accounting;

import java.time.Duration;
import java.time.Instant;

/**
 * One recorded failure of a tool.
 */
public record ErrorOccurrence(Instant timestamp, String error, int retryCount, Duration duration) {
}
