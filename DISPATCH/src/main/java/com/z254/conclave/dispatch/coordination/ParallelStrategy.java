package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentOutcome;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans a task out to the most available matching agents at once.
 * Harder tasks get more agents: {@code round(complexity * 3) + 1}, capped by the number of matches.
 */
@Component
@Slf4j
public class ParallelStrategy implements CoordinationStrategy {

    private final AgentDispatcher dispatcher;

    public ParallelStrategy(AgentDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.PARALLEL;
    }

    @Override
    public Mono<CoordinationResult> coordinate(List<AgentCapabilities> agents, CoordinationTask task) {
        List<AgentCapabilities> matches = AgentRanking.matching(agents, task);
        if (matches.isEmpty()) {
            return Mono.just(CoordinationResult.status(CoordinationStatus.NO_AGENTS_AVAILABLE, getName(),
                    task.getTaskId(), "No agent has capabilities " + task.getRequiredCapabilities()));
        }

        int width = fanOut(task.getComplexity(), matches.size());
        List<AgentCapabilities> selected = AgentRanking.byAvailability(matches).subList(0, width);

        // Confidence reflects each agent's record at selection time
        Map<String, Double> confidences = new LinkedHashMap<>();
        selected.forEach(agent -> confidences.put(agent.getName(), confidence(agent, task)));

        log.debug("Parallel execution of task {} across {} of {} matching agents",
                task.getTaskId(), width, matches.size());

        return Flux.fromIterable(selected)
                .flatMapSequential(agent -> dispatcher.dispatch(agent, task, task.getInputData(), getName(), 0)
                        .map(outcome -> outcome.toBuilder()
                                .confidence(outcome.isSuccess() ? confidences.get(agent.getName()) : 0.0)
                                .build()))
                .collectList()
                .map(outcomes -> aggregate(task, selected, outcomes));
    }

    private CoordinationResult aggregate(CoordinationTask task, List<AgentCapabilities> selected,
                                         List<AgentOutcome> outcomes) {
        List<AgentOutcome> successful = outcomes.stream().filter(AgentOutcome::isSuccess).toList();
        Map<String, Object> outputs = new LinkedHashMap<>();
        successful.forEach(outcome -> outputs.put(outcome.getAgentName(), outcome.getOutput()));
        double confidence = successful.stream()
                .mapToDouble(AgentOutcome::getConfidence)
                .average()
                .orElse(0.0);

        return CoordinationResult.builder()
                .status(successful.isEmpty() ? CoordinationStatus.FAILED : CoordinationStatus.COMPLETED)
                .strategyName(getName())
                .taskId(task.getTaskId())
                .selectedAgents(selected.stream().map(AgentCapabilities::getName).toList())
                .outcomes(outcomes)
                .confidence(confidence)
                .finalOutput(outputs)
                .message(successful.size() + " of " + outcomes.size() + " agents succeeded")
                .build();
    }

    static int fanOut(double complexity, int matches) {
        int width = (int) Math.round(complexity * 3) + 1;
        return Math.max(1, Math.min(width, matches));
    }

    static double confidence(AgentCapabilities agent, CoordinationTask task) {
        return agent.getSuccessRate() * (1.0 - task.getComplexity() * 0.2);
    }
}
