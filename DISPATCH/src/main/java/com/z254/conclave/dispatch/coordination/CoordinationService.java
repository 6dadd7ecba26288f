package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.agent.AgentCapabilityPool;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for coordinating a task across the agent pool with a chosen strategy.
 */
@Service
@Slf4j
public class CoordinationService {

    public static final StrategyType DEFAULT_STRATEGY = StrategyType.LOAD_BALANCED;

    private final AgentCapabilityPool pool;
    private final Map<StrategyType, CoordinationStrategy> strategies;
    private final MeterRegistry meterRegistry;

    public CoordinationService(
            AgentCapabilityPool pool,
            List<CoordinationStrategy> strategies,
            MeterRegistry meterRegistry) {
        this.pool = pool;
        this.meterRegistry = meterRegistry;

        this.strategies = new EnumMap<>(StrategyType.class);
        strategies.forEach(strategy -> this.strategies.put(strategy.getType(), strategy));
        log.info("Initialized CoordinationService with {} strategies", this.strategies.size());
    }

    public Mono<CoordinationResult> execute(CoordinationTask task) {
        return execute(task, DEFAULT_STRATEGY);
    }

    /**
     * Coordinate a task. Never signals an error; problems are reported through the result status.
     */
    public Mono<CoordinationResult> execute(CoordinationTask task, StrategyType type) {
        String strategyName = type != null ? type.name().toLowerCase(Locale.ROOT) : "unknown";

        List<String> problems = task.validate();
        if (!problems.isEmpty()) {
            log.warn("Rejected task {}: {}", task.getTaskId(), problems);
            return Mono.just(record(CoordinationResult.status(CoordinationStatus.INVALID_TASK, strategyName,
                    task.getTaskId(), String.join("; ", problems))));
        }

        CoordinationStrategy strategy = type != null ? strategies.get(type) : null;
        if (strategy == null) {
            log.warn("Unknown coordination strategy {} for task {}", type, task.getTaskId());
            return Mono.just(record(CoordinationResult.status(CoordinationStatus.UNKNOWN_STRATEGY, strategyName,
                    task.getTaskId(), "Unknown coordination strategy: " + type)));
        }

        Mono<CoordinationResult> coordination = Mono.defer(() -> strategy.coordinate(pool.getAll(), task));
        if (task.getDeadline() != null) {
            Duration remaining = Duration.between(Instant.now(), task.getDeadline());
            if (remaining.isNegative() || remaining.isZero()) {
                return Mono.just(record(deadlineExceeded(task, strategy)));
            }
            coordination = coordination.timeout(remaining)
                    .onErrorResume(TimeoutException.class, e -> Mono.just(deadlineExceeded(task, strategy)));
        }

        return coordination
                .onErrorResume(e -> {
                    log.error("Coordination of task {} with {} failed: {}",
                            task.getTaskId(), strategy.getName(), e.getMessage(), e);
                    return Mono.just(CoordinationResult.status(CoordinationStatus.FAILED, strategy.getName(),
                            task.getTaskId(), "Coordination error: " + e.getMessage()));
                })
                .map(this::record);
    }

    public Set<StrategyType> getSupportedStrategies() {
        return strategies.keySet();
    }

    private CoordinationResult deadlineExceeded(CoordinationTask task, CoordinationStrategy strategy) {
        log.warn("Task {} missed its deadline {}", task.getTaskId(), task.getDeadline());
        return CoordinationResult.status(CoordinationStatus.DEADLINE_EXCEEDED, strategy.getName(),
                task.getTaskId(), "Deadline " + task.getDeadline() + " exceeded");
    }

    private CoordinationResult record(CoordinationResult result) {
        Counter.builder("dispatch.coordination.results")
                .tag("strategy", result.getStrategyName())
                .tag("status", result.getStatus().getValue())
                .register(meterRegistry)
                .increment();
        log.debug("Task {} via {}: {}", result.getTaskId(), result.getStrategyName(), result.getStatus().getValue());
        return result;
    }
}
