package com.z254.conclave.dispatch.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work to be allocated across the agent pool.
 */
@Value
@Builder(toBuilder = true)
public class CoordinationTask {

    public static final int DEFAULT_PRIORITY = 5;

    String taskId;

    String taskType;

    /**
     * Difficulty in [0, 1]. Drives fan-out width and confidence discounting.
     */
    double complexity;

    @Singular
    Set<String> requiredCapabilities;

    @Singular("input")
    Map<String, Object> inputData;

    @Builder.Default
    int priority = DEFAULT_PRIORITY;

    Instant deadline;

    @Singular
    List<String> dependencies;

    /**
     * An agent matches when it declares every required capability.
     */
    public boolean matches(AgentCapabilities agent) {
        return agent.hasAll(requiredCapabilities);
    }

    /**
     * Problems that make this task impossible to coordinate. Empty when valid.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (taskId == null || taskId.isBlank()) {
            problems.add("task_id is required");
        }
        if (Double.isNaN(complexity) || complexity < 0.0 || complexity > 1.0) {
            problems.add("complexity must be within [0, 1]: " + complexity);
        }
        if (priority < 1 || priority > 10) {
            problems.add("priority must be within [1, 10]: " + priority);
        }
        return problems;
    }
}
