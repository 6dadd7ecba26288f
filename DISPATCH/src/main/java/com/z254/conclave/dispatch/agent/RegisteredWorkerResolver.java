package com.z254.conclave.dispatch.agent;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.tool.Tool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves agents to tools: explicit binding first, then a tool named like the agent,
 * then the first registered tool the agent declares.
 */
@Component
@Slf4j
public class RegisteredWorkerResolver implements AgentWorkerResolver {

    private final Map<String, Tool> toolsByName = new ConcurrentHashMap<>();
    private final Map<String, Tool> bindings = new ConcurrentHashMap<>();

    public RegisteredWorkerResolver(ObjectProvider<Tool> tools) {
        tools.orderedStream().forEach(this::registerTool);
    }

    public void registerTool(Tool tool) {
        toolsByName.put(tool.getName(), tool);
        log.debug("Registered worker tool: {}", tool.getName());
    }

    /**
     * Bind an agent to a specific tool regardless of names.
     */
    public void bind(String agentName, Tool tool) {
        bindings.put(agentName, tool);
        log.info("Bound agent {} to tool {}", agentName, tool.getName());
    }

    public boolean unbind(String agentName) {
        return bindings.remove(agentName) != null;
    }

    @Override
    public Optional<Tool> resolve(AgentCapabilities agent, CoordinationTask task) {
        Tool bound = bindings.get(agent.getName());
        if (bound != null) {
            return Optional.of(bound);
        }
        Tool named = toolsByName.get(agent.getName());
        if (named != null) {
            return Optional.of(named);
        }
        return agent.getTools().stream()
                .map(toolsByName::get)
                .filter(Objects::nonNull)
                .findFirst();
    }
}
