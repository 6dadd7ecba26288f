package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import com.z254.conclave.dispatch.tool.ErrorTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Sends the task to the single most available matching agent.
 */
@Component
@Slf4j
public class LoadBalancedStrategy implements CoordinationStrategy {

    private final AgentDispatcher dispatcher;

    public LoadBalancedStrategy(AgentDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.LOAD_BALANCED;
    }

    @Override
    public Mono<CoordinationResult> coordinate(List<AgentCapabilities> agents, CoordinationTask task) {
        List<AgentCapabilities> matches = AgentRanking.matching(agents, task);
        if (matches.isEmpty()) {
            return Mono.just(CoordinationResult.status(CoordinationStatus.NO_AGENTS_AVAILABLE, getName(),
                    task.getTaskId(), "No agent has capabilities " + task.getRequiredCapabilities()));
        }

        AgentCapabilities best = AgentRanking.byAvailability(matches).get(0);
        if (!best.hasCapacity()) {
            return Mono.just(busy(task, best));
        }

        int loadBefore = best.getCurrentLoad();
        double confidence = best.getSuccessRate();
        log.debug("Load-balanced execution of task {} on {} (load {}/{})",
                task.getTaskId(), best.getName(), loadBefore, best.getMaxConcurrentTasks());

        return dispatcher.dispatch(best, task, task.getInputData(), getName(), 0)
                .map(outcome -> {
                    if (ErrorTypes.AGENT_BUSY.equals(outcome.getErrorType())) {
                        return busy(task, best);
                    }
                    return CoordinationResult.builder()
                            .status(outcome.isSuccess() ? CoordinationStatus.COMPLETED : CoordinationStatus.FAILED)
                            .strategyName(getName())
                            .taskId(task.getTaskId())
                            .selectedAgent(best.getName())
                            .outcome(outcome.toBuilder().confidence(outcome.isSuccess() ? confidence : 0.0).build())
                            .confidence(outcome.isSuccess() ? confidence : 0.0)
                            .finalOutput(outcome.getOutput())
                            .attribute("load_before", loadBefore)
                            .attribute("load_after", best.getCurrentLoad())
                            .message(outcome.isSuccess() ? "Completed by " + best.getName() : outcome.getError())
                            .build();
                });
    }

    private CoordinationResult busy(CoordinationTask task, AgentCapabilities best) {
        return CoordinationResult.builder()
                .status(CoordinationStatus.ALL_AGENTS_BUSY)
                .strategyName(getName())
                .taskId(task.getTaskId())
                .message("Best matching agent " + best.getName() + " is at capacity ("
                        + best.getCurrentLoad() + "/" + best.getMaxConcurrentTasks() + ")")
                .build();
    }
}
