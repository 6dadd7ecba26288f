package com.z254.conclave.dispatch.agent;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.tool.Tool;

import java.util.Optional;

/**
 * Chooses the concrete implementation that performs an agent's work for a task.
 */
public interface AgentWorkerResolver {

    Optional<Tool> resolve(AgentCapabilities agent, CoordinationTask task);
}
