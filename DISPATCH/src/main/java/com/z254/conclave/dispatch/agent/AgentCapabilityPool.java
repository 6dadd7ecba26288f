package com.z254.conclave.dispatch.agent;

import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentWorkload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of coordination agents.
 * The pool only stores agents; strategies decide who runs what.
 */
@Component
@Slf4j
public class AgentCapabilityPool {

    private final Map<String, AgentCapabilities> agents = new ConcurrentHashMap<>();

    public AgentCapabilityPool(DispatchProperties dispatchProperties) {
        for (DispatchProperties.AgentDefinition definition : dispatchProperties.getPool().getAgents()) {
            register(fromDefinition(definition));
        }
        log.info("Agent pool initialized with {} agents", agents.size());
    }

    public void register(AgentCapabilities agent) {
        AgentCapabilities previous = agents.put(agent.getName(), agent);
        if (previous != null) {
            log.warn("Replaced agent registration: {}", agent.getName());
        } else {
            log.info("Registered agent: {} ({})", agent.getName(), agent.getSpecializations());
        }
    }

    public boolean unregister(String name) {
        AgentCapabilities removed = agents.remove(name);
        if (removed != null) {
            log.info("Unregistered agent: {}", name);
            return true;
        }
        return false;
    }

    public Optional<AgentCapabilities> get(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public List<AgentCapabilities> getAll() {
        return new ArrayList<>(agents.values());
    }

    /**
     * Agents below their concurrency ceiling.
     */
    public List<AgentCapabilities> getAvailableAgents() {
        return agents.values().stream()
                .filter(AgentCapabilities::hasCapacity)
                .toList();
    }

    public List<AgentCapabilities> getBySpecialization(String specialization) {
        return agents.values().stream()
                .filter(agent -> agent.getSpecializations().contains(specialization))
                .toList();
    }

    public List<AgentWorkload> getWorkloadReport() {
        return agents.values().stream()
                .map(AgentCapabilities::workload)
                .toList();
    }

    public int size() {
        return agents.size();
    }

    static AgentCapabilities fromDefinition(DispatchProperties.AgentDefinition definition) {
        return AgentCapabilities.builder()
                .name(definition.getName())
                .specializations(definition.getSpecializations())
                .tools(definition.getTools())
                .maxConcurrentTasks(definition.getMaxConcurrentTasks())
                .successRate(definition.getSuccessRate())
                .avgResponseTime(definition.getAvgResponseTime())
                .build();
    }
}
