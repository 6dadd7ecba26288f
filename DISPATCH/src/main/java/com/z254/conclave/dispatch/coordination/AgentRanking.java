package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;

import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filtering and ordering of candidate agents.
 * Scores are read once per call so concurrent load changes cannot break the ordering.
 */
final class AgentRanking {

    private AgentRanking() {
    }

    static List<AgentCapabilities> matching(List<AgentCapabilities> agents, CoordinationTask task) {
        return agents.stream()
                .filter(task::matches)
                .sorted(Comparator.comparing(AgentCapabilities::getName))
                .toList();
    }

    /**
     * Highest availability first; ties keep the input order.
     */
    static List<AgentCapabilities> byAvailability(List<AgentCapabilities> agents) {
        Map<AgentCapabilities, Double> scores = new IdentityHashMap<>();
        agents.forEach(agent -> scores.put(agent, agent.availabilityScore()));
        return agents.stream()
                .sorted(Comparator.comparingDouble((AgentCapabilities agent) -> scores.get(agent)).reversed())
                .toList();
    }

    /**
     * Most required capabilities covered first, then highest success rate.
     */
    static List<AgentCapabilities> byFitness(List<AgentCapabilities> agents, CoordinationTask task) {
        Map<AgentCapabilities, Long> overlaps = new IdentityHashMap<>();
        Map<AgentCapabilities, Double> rates = new IdentityHashMap<>();
        agents.forEach(agent -> {
            overlaps.put(agent, agent.overlap(task.getRequiredCapabilities()));
            rates.put(agent, agent.getSuccessRate());
        });
        return agents.stream()
                .sorted(Comparator.comparingLong((AgentCapabilities agent) -> overlaps.get(agent))
                        .thenComparingDouble(rates::get)
                        .reversed())
                .toList();
    }
}
