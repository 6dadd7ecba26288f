package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Interface for coordination algorithms.
 * Strategies filter the candidate agents to those matching the task and never signal errors:
 * allocation failures are reported through the result status.
 */
public interface CoordinationStrategy {

    /**
     * Get the strategy type this implementation handles.
     */
    StrategyType getType();

    /**
     * Allocate the task across the given agents and aggregate the outcome.
     *
     * @param agents candidate agents
     * @param task the task
     * @return coordination result
     */
    Mono<CoordinationResult> coordinate(List<AgentCapabilities> agents, CoordinationTask task);

    default String getName() {
        return getType().name().toLowerCase(Locale.ROOT);
    }
}
