package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.agent.AgentWorkerResolver;
import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentOutcome;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.interceptor.ToolExecutionInterceptor;
import com.z254.conclave.dispatch.tool.ErrorTypes;
import com.z254.conclave.dispatch.tool.Tool;
import com.z254.conclave.dispatch.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one agent's share of a task through the execution interceptor.
 * Holds one of the agent's slots for the duration of the call.
 */
@Component
@Slf4j
public class AgentDispatcher {

    public static final String CONTEXT_TASK_ID = "task_id";
    public static final String CONTEXT_TASK_TYPE = "task_type";
    public static final String CONTEXT_AGENT = "agent";
    public static final String CONTEXT_STRATEGY = "strategy";
    public static final String CONTEXT_PRIORITY = "priority";
    public static final String CONTEXT_STAGE = "stage";

    private final ToolExecutionInterceptor interceptor;
    private final AgentWorkerResolver workerResolver;
    private final DispatchProperties.PoolProperties config;

    public AgentDispatcher(
            ToolExecutionInterceptor interceptor,
            AgentWorkerResolver workerResolver,
            DispatchProperties dispatchProperties) {
        this.interceptor = interceptor;
        this.workerResolver = workerResolver;
        this.config = dispatchProperties.getPool();
    }

    /**
     * Dispatch work to an agent.
     *
     * @param stage pipeline stage starting at 1, or 0 outside pipelines
     * @return the outcome; never an error signal
     */
    public Mono<AgentOutcome> dispatch(AgentCapabilities agent, CoordinationTask task,
                                       Map<String, Object> input, String strategyName, int stage) {
        return Mono.defer(() -> {
            Optional<Tool> worker = workerResolver.resolve(agent, task);
            if (worker.isEmpty()) {
                log.warn("No worker bound to agent {} for task {}", agent.getName(), task.getTaskId());
                return Mono.just(notDispatched(agent, stage, ErrorTypes.NO_WORKER,
                        "No worker bound to agent " + agent.getName()));
            }
            if (!agent.tryAcquireSlot()) {
                log.debug("Agent {} at capacity ({}), skipping task {}",
                        agent.getName(), agent.getMaxConcurrentTasks(), task.getTaskId());
                return Mono.just(notDispatched(agent, stage, ErrorTypes.AGENT_BUSY,
                        "Agent " + agent.getName() + " is at capacity"));
            }

            AtomicBoolean released = new AtomicBoolean();
            Runnable release = () -> {
                if (released.compareAndSet(false, true)) {
                    agent.releaseSlot();
                }
            };

            Tool tool = worker.get();
            String executionId = tool.getName() + "_" + UUID.randomUUID();
            return interceptor.execute(tool, input, context(task, agent, strategyName, stage), executionId)
                    .map(result -> toOutcome(agent, executionId, stage, result))
                    .doOnNext(outcome -> recordPerformance(agent, outcome))
                    .doOnTerminate(release)
                    .doOnCancel(release);
        });
    }

    private Map<String, Object> context(CoordinationTask task, AgentCapabilities agent, String strategyName,
                                        int stage) {
        Map<String, Object> context = new HashMap<>();
        context.put(CONTEXT_TASK_ID, task.getTaskId());
        if (task.getTaskType() != null) {
            context.put(CONTEXT_TASK_TYPE, task.getTaskType());
        }
        context.put(CONTEXT_AGENT, agent.getName());
        context.put(CONTEXT_STRATEGY, strategyName);
        context.put(CONTEXT_PRIORITY, task.getPriority());
        if (stage > 0) {
            context.put(CONTEXT_STAGE, stage);
        }
        return context;
    }

    private void recordPerformance(AgentCapabilities agent, AgentOutcome outcome) {
        if (!config.isPerformanceTrackingEnabled()) {
            return;
        }
        double seconds = outcome.getDuration() != null ? outcome.getDuration().toMillis() / 1000.0 : 0.0;
        agent.recordOutcome(outcome.isSuccess(), seconds, config.getPerformanceSmoothing());
    }

    private static AgentOutcome toOutcome(AgentCapabilities agent, String executionId, int stage, ToolResult result) {
        return AgentOutcome.builder()
                .agentName(agent.getName())
                .executionId(executionId)
                .success(result.isSuccess())
                .output(result.getOutput())
                .error(result.getError())
                .errorType(result.getErrorType())
                .duration(result.getDuration())
                .fromCache(result.isFromCache())
                .stage(stage)
                .build();
    }

    private static AgentOutcome notDispatched(AgentCapabilities agent, int stage, String errorType, String error) {
        return AgentOutcome.builder()
                .agentName(agent.getName())
                .success(false)
                .error(error)
                .errorType(errorType)
                .duration(Duration.ZERO)
                .stage(stage)
                .build();
    }
}
