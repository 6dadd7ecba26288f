package com.z254.conclave.dispatch.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Result of dispatching a task (or a pipeline stage) to one agent.
 */
@Value
@Builder(toBuilder = true)
public class AgentOutcome {

    String agentName;

    String executionId;

    boolean success;

    Object output;

    String error;

    String errorType;

    /**
     * Confidence the strategy assigns to this outcome.
     */
    double confidence;

    Duration duration;

    boolean fromCache;

    /**
     * Pipeline stage, starting at 1. Zero for non-pipelined strategies.
     */
    int stage;
}
