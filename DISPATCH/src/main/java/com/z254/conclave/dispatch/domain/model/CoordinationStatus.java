package com.z254.conclave.dispatch.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a coordination attempt.
 */
public enum CoordinationStatus {
    COMPLETED("completed"),
    FAILED("failed"),
    NO_AGENTS_AVAILABLE("no_agents_available"),
    INSUFFICIENT_AGENTS("insufficient_agents"),
    ALL_AGENTS_BUSY("all_agents_busy"),
    INVALID_TASK("invalid_task"),
    DEADLINE_EXCEEDED("deadline_exceeded"),
    UNKNOWN_STRATEGY("unknown_strategy");

    private final String value;

    CoordinationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether any agent work was performed and produced a usable result.
     */
    public boolean isCompleted() {
        return this == COMPLETED;
    }
}
