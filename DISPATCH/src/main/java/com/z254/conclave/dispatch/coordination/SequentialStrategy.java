package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentOutcome;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the best-fitting agents as a pipeline. Each stage's output is the next stage's input;
 * a failed stage ends the pipeline.
 */
@Component
@Slf4j
public class SequentialStrategy implements CoordinationStrategy {

    /**
     * Input key used when a stage produced something other than a map.
     */
    public static final String PIPED_INPUT_KEY = "input";

    private final AgentDispatcher dispatcher;
    private final int maxStages;

    public SequentialStrategy(AgentDispatcher dispatcher, DispatchProperties dispatchProperties) {
        this.dispatcher = dispatcher;
        this.maxStages = dispatchProperties.getCoordination().getSequentialMaxStages();
    }

    @Override
    public StrategyType getType() {
        return StrategyType.SEQUENTIAL;
    }

    @Override
    public Mono<CoordinationResult> coordinate(List<AgentCapabilities> agents, CoordinationTask task) {
        List<AgentCapabilities> matches = AgentRanking.matching(agents, task);
        if (matches.isEmpty()) {
            return Mono.just(CoordinationResult.status(CoordinationStatus.NO_AGENTS_AVAILABLE, getName(),
                    task.getTaskId(), "No agent has capabilities " + task.getRequiredCapabilities()));
        }

        List<AgentCapabilities> stages = AgentRanking.byFitness(matches, task).stream()
                .limit(maxStages)
                .toList();
        double confidence = stages.stream()
                .mapToDouble(AgentCapabilities::getSuccessRate)
                .reduce(1.0, (a, b) -> a * b);

        log.debug("Sequential execution of task {} through {}", task.getTaskId(),
                stages.stream().map(AgentCapabilities::getName).toList());

        return runStage(stages, 0, task, task.getInputData(), new ArrayList<>())
                .map(trace -> aggregate(task, stages, trace, confidence));
    }

    private Mono<List<AgentOutcome>> runStage(List<AgentCapabilities> stages, int index, CoordinationTask task,
                                              Map<String, Object> input, List<AgentOutcome> trace) {
        if (index >= stages.size()) {
            return Mono.just(trace);
        }
        AgentCapabilities agent = stages.get(index);
        return dispatcher.dispatch(agent, task, input, getName(), index + 1)
                .flatMap(outcome -> {
                    trace.add(outcome);
                    if (!outcome.isSuccess()) {
                        log.warn("Stage {} ({}) of task {} failed: {}",
                                index + 1, agent.getName(), task.getTaskId(), outcome.getError());
                        return Mono.just(trace);
                    }
                    return runStage(stages, index + 1, task, pipe(outcome.getOutput()), trace);
                });
    }

    private CoordinationResult aggregate(CoordinationTask task, List<AgentCapabilities> stages,
                                         List<AgentOutcome> trace, double confidence) {
        AgentOutcome last = trace.get(trace.size() - 1);
        boolean completed = trace.size() == stages.size() && last.isSuccess();

        return CoordinationResult.builder()
                .status(completed ? CoordinationStatus.COMPLETED : CoordinationStatus.FAILED)
                .strategyName(getName())
                .taskId(task.getTaskId())
                .selectedAgents(stages.stream().map(AgentCapabilities::getName).toList())
                .outcomes(trace)
                .confidence(completed ? confidence : 0.0)
                .finalOutput(completed ? last.getOutput() : null)
                .message(completed
                        ? "Pipeline completed in " + trace.size() + " stages"
                        : "Stage " + last.getStage() + " (" + last.getAgentName() + ") failed: " + last.getError())
                .build();
    }

    /**
     * Turn a stage's output into the next stage's input.
     */
    static Map<String, Object> pipe(Object output) {
        Map<String, Object> next = new LinkedHashMap<>();
        if (output instanceof Map<?, ?> map) {
            map.forEach((key, value) -> next.put(String.valueOf(key), value));
        } else {
            next.put(PIPED_INPUT_KEY, output);
        }
        return next;
    }
}
