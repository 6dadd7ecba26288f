package com.z254.conclave.dispatch.interceptor;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * An admitted, not yet finished execution.
 */
@Getter
@ToString(exclude = {"input", "context"})
public class ActiveExecution {

    private final String executionId;
    private final String toolName;
    private final Instant startTime;
    private final Map<String, Object> input;
    private final Map<String, Object> context;

    @Setter
    private volatile Phase phase = Phase.STARTING;

    public ActiveExecution(String executionId, String toolName, Instant startTime,
                           Map<String, Object> input, Map<String, Object> context) {
        this.executionId = executionId;
        this.toolName = toolName;
        this.startTime = startTime;
        this.input = input;
        this.context = context;
    }

    public Duration getElapsed() {
        return Duration.between(startTime, Instant.now());
    }

    public enum Phase {
        STARTING,
        EXECUTING,
        COMPLETING
    }
}
