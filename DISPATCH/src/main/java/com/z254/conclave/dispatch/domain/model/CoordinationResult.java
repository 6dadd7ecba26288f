package com.z254.conclave.dispatch.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one coordination call.
 */
@Value
@Builder(toBuilder = true)
public class CoordinationResult {

    CoordinationStatus status;

    String strategyName;

    String taskId;

    @Singular
    List<String> selectedAgents;

    /**
     * Per-agent outcomes. For pipelines, one per stage in order.
     */
    @Singular
    List<AgentOutcome> outcomes;

    @Singular
    List<Vote> votes;

    /**
     * Committee decision.
     */
    VoteDecision decision;

    double confidence;

    /**
     * Output of the last pipeline stage or the single dispatched agent.
     */
    Object finalOutput;

    String message;

    /**
     * Strategy-specific details.
     */
    @Singular
    Map<String, Object> attributes;

    @Builder.Default
    Instant completedAt = Instant.now();

    public static CoordinationResult status(CoordinationStatus status, String strategyName, String taskId,
                                            String message) {
        return CoordinationResult.builder()
                .status(status)
                .strategyName(strategyName)
                .taskId(taskId)
                .message(message)
                .build();
    }

    public boolean isCompleted() {
        return status != null && status.isCompleted();
    }

    public List<AgentOutcome> successfulOutcomes() {
        return outcomes.stream().filter(AgentOutcome::isSuccess).toList();
    }
}
