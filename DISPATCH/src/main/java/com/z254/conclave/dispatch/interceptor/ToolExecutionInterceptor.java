package com.z254.conclave.dispatch.interceptor;

import com.z254.conclave.dispatch.accounting.ErrorAnalysis;
import com.z254.conclave.dispatch.accounting.ExecutionAccounting;
import com.z254.conclave.dispatch.accounting.ExecutionHistoryEntry;
import com.z254.conclave.dispatch.accounting.ExecutionStatistics;
import com.z254.conclave.dispatch.accounting.ToolExecutionCounts;
import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.hook.HookEvent;
import com.z254.conclave.dispatch.hook.HookRegistry;
import com.z254.conclave.dispatch.hook.HookType;
import com.z254.conclave.dispatch.resilience.ToolCircuitBreakers;
import com.z254.conclave.dispatch.tool.ErrorTypes;
import com.z254.conclave.dispatch.tool.Tool;
import com.z254.conclave.dispatch.tool.ToolExecutionException;
import com.z254.conclave.dispatch.tool.ToolResult;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps tool executions with lifecycle hooks, a global concurrency limit, timeouts,
 * circuit breaking and rolling statistics.
 *
 * <p>{@link #execute} never signals an error: tool failures, timeouts and internal faults
 * all come back as a failed {@link ToolResult}.
 */
@Component
@Slf4j
public class ToolExecutionInterceptor {

    public static final String CONTEXT_EXECUTION_ID = "execution_id";

    private final DispatchProperties.InterceptorProperties config;
    private final HookRegistry hookRegistry;
    private final ExecutionAccounting accounting;
    private final ToolCircuitBreakers circuitBreakers;
    private final ConcurrencyLimiter limiter;
    private final MeterRegistry meterRegistry;

    private final Counter timeoutCounter;
    private final Counter interceptorErrorCounter;
    private final Counter validationErrorCounter;
    private final Counter circuitOpenCounter;

    private final Map<String, ActiveExecution> activeExecutions = new ConcurrentHashMap<>();

    public ToolExecutionInterceptor(
            DispatchProperties dispatchProperties,
            HookRegistry hookRegistry,
            ExecutionAccounting accounting,
            ToolCircuitBreakers circuitBreakers,
            MeterRegistry meterRegistry) {
        this.config = dispatchProperties.getInterceptor();
        this.hookRegistry = hookRegistry;
        this.accounting = accounting;
        this.circuitBreakers = circuitBreakers;
        this.limiter = new ConcurrencyLimiter(config.getMaxConcurrentExecutions());
        this.meterRegistry = meterRegistry;

        this.timeoutCounter = Counter.builder("dispatch.tool.timeouts")
                .register(meterRegistry);
        this.interceptorErrorCounter = Counter.builder("dispatch.interceptor.errors")
                .register(meterRegistry);
        this.validationErrorCounter = Counter.builder("dispatch.tool.validation.errors")
                .register(meterRegistry);
        this.circuitOpenCounter = Counter.builder("dispatch.tool.circuit.open")
                .register(meterRegistry);
        Gauge.builder("dispatch.interceptor.active", activeExecutions, Map::size)
                .register(meterRegistry);
        Gauge.builder("dispatch.interceptor.queued", limiter, ConcurrencyLimiter::queueLength)
                .register(meterRegistry);
    }

    public Mono<ToolResult> execute(Tool tool, Map<String, Object> input, Map<String, Object> context) {
        return execute(tool, input, context, null);
    }

    /**
     * Execute a tool through the full lifecycle.
     *
     * @param tool the tool to run
     * @param input tool input
     * @param context caller context; copied, then {@code execution_id} is added
     * @param executionId id to use, or null to generate one
     * @return the result; never an error signal
     */
    public Mono<ToolResult> execute(Tool tool, Map<String, Object> input, Map<String, Object> context,
                                    String executionId) {
        long submittedAt = System.nanoTime();
        return Mono.defer(() -> {
                    String toolName = tool.getName();
                    String id = executionId != null ? executionId : generateExecutionId(toolName);
                    Map<String, Object> toolInput = input != null ? input : Map.of();
                    Map<String, Object> executionContext = new HashMap<>(context != null ? context : Map.of());
                    executionContext.put(CONTEXT_EXECUTION_ID, id);

                    return limiter.acquire()
                            .flatMap(permit -> Mono.defer(() -> admit(
                                            new ExecutionScope(tool, toolName, id, toolInput, executionContext),
                                            permit))
                                    .doOnTerminate(permit::release));
                })
                .onErrorResume(e -> {
                    interceptorErrorCounter.increment();
                    log.error("Interceptor error while executing {}: {}", safeName(tool), e.getMessage(), e);
                    return Mono.just(ToolResult.interceptorError(
                            String.valueOf(e.getMessage()), Duration.ofNanos(System.nanoTime() - submittedAt)));
                });
    }

    private Mono<ToolResult> admit(ExecutionScope scope, ConcurrencyLimiter.Permit permit) {
        ActiveExecution active = new ActiveExecution(
                scope.executionId(), scope.toolName(), Instant.now(), scope.input(), scope.context());
        if (activeExecutions.putIfAbsent(scope.executionId(), active) != null) {
            log.warn("Execution id {} is already in flight, rejecting", scope.executionId());
            return Mono.just(ToolResult.failure(
                    ErrorTypes.VALIDATION, "Execution id already in flight: " + scope.executionId()));
        }

        AtomicBoolean finished = new AtomicBoolean();
        Runnable cleanup = () -> {
            if (finished.compareAndSet(false, true)) {
                activeExecutions.remove(scope.executionId(), active);
                permit.release();
            }
        };

        return hookRegistry.fire(HookType.PRE_EXECUTION, scope.event().build())
                .then(Mono.defer(() -> {
                    active.setPhase(ActiveExecution.Phase.EXECUTING);
                    return invoke(scope);
                }))
                .flatMap(result -> {
                    active.setPhase(ActiveExecution.Phase.COMPLETING);
                    return complete(scope, result);
                })
                .doOnTerminate(cleanup)
                .doOnCancel(cleanup);
    }

    private Mono<ToolResult> invoke(ExecutionScope scope) {
        return Mono.defer(() -> scope.tool().validate(scope.input()))
                .defaultIfEmpty(Tool.ValidationResult.success())
                .onErrorResume(e -> Mono.just(Tool.ValidationResult.failure(
                        "Validation raised " + e.getClass().getSimpleName() + ": " + e.getMessage())))
                .flatMap(validation -> validation.valid()
                        ? guardedInvoke(scope)
                        : rejectInvalid(scope, validation));
    }

    private Mono<ToolResult> rejectInvalid(ExecutionScope scope, Tool.ValidationResult validation) {
        validationErrorCounter.increment();
        String message = "Input validation failed: " + String.join("; ", validation.errors());
        log.warn("Tool {} [{}] rejected: {}", scope.toolName(), scope.executionId(), message);
        ToolResult result = ToolResult.failure(ErrorTypes.VALIDATION, message);
        return hookRegistry.fire(HookType.ON_VALIDATION_ERROR, scope.event()
                        .error(message)
                        .errorType(ErrorTypes.VALIDATION)
                        .build())
                .thenReturn(result);
    }

    private Mono<ToolResult> guardedInvoke(ExecutionScope scope) {
        CircuitBreaker breaker = circuitBreakers.forTool(scope.toolName()).orElse(null);
        if (breaker != null && !breaker.tryAcquirePermission()) {
            circuitOpenCounter.increment();
            String message = "Circuit breaker is " + breaker.getState() + " for tool " + scope.toolName();
            log.warn("Tool {} [{}] short-circuited: {}", scope.toolName(), scope.executionId(), message);
            return hookRegistry.fire(HookType.ON_CIRCUIT_OPEN, scope.event()
                            .error(message)
                            .errorType(ErrorTypes.CIRCUIT_OPEN)
                            .build())
                    .thenReturn(ToolResult.failure(ErrorTypes.CIRCUIT_OPEN, message));
        }

        Duration timeout = scope.tool().getTimeout();
        Mono<ToolResult> call = Mono.defer(() -> scope.tool().execute(scope.input(), scope.context()))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Tool " + scope.toolName() + " completed without a result")));
        if (timeout != null) {
            call = call.timeout(timeout);
        }

        AtomicBoolean settled = new AtomicBoolean();
        return call
                .onErrorResume(TimeoutException.class, e -> onTimeout(scope, timeout))
                .onErrorResume(e -> Mono.just(onToolException(scope, e)))
                .doOnNext(result -> {
                    if (breaker != null && settled.compareAndSet(false, true)) {
                        recordOutcome(breaker, scope, result);
                    }
                })
                .doOnCancel(() -> {
                    if (breaker != null && settled.compareAndSet(false, true)) {
                        breaker.releasePermission();
                    }
                });
    }

    private Mono<ToolResult> onTimeout(ExecutionScope scope, Duration timeout) {
        timeoutCounter.increment();
        Duration elapsed = scope.elapsed();
        ToolResult result = ToolResult.timeout(timeout, elapsed);
        log.warn("Tool {} [{}] timed out after {}ms", scope.toolName(), scope.executionId(), elapsed.toMillis());
        return hookRegistry.fire(HookType.ON_TIMEOUT, scope.event()
                        .timeout(timeout)
                        .duration(elapsed)
                        .result(result)
                        .error(result.getError())
                        .errorType(ErrorTypes.TIMEOUT)
                        .build())
                .thenReturn(result);
    }

    private ToolResult onToolException(ExecutionScope scope, Throwable e) {
        String errorType = e.getClass().getSimpleName();
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        log.warn("Tool {} [{}] raised {}: {}", scope.toolName(), scope.executionId(), errorType, message);
        return ToolResult.failure(errorType, message);
    }

    private void recordOutcome(CircuitBreaker breaker, ExecutionScope scope, ToolResult result) {
        long nanos = scope.elapsed().toNanos();
        if (result.isSuccess()) {
            breaker.onSuccess(nanos, TimeUnit.NANOSECONDS);
        } else {
            breaker.onError(nanos, TimeUnit.NANOSECONDS,
                    new ToolExecutionException(result.getErrorType(), result.getError()));
        }
    }

    private ToolResult normalize(ToolResult result, Duration duration) {
        boolean untypedFailure = !result.isSuccess() && result.getErrorType() == null;
        if (result.getDuration() != null && !untypedFailure) {
            return result;
        }
        ToolResult.ToolResultBuilder builder = result.toBuilder().duration(duration);
        if (untypedFailure) {
            builder.errorType(ErrorTypes.TOOL_FAILURE);
        }
        return builder.build();
    }

    private Mono<ToolResult> complete(ExecutionScope scope, ToolResult result) {
        Duration duration = result.getDuration() != null ? result.getDuration() : scope.elapsed();
        ToolResult finalResult = normalize(result, duration);
        HookEvent event = scope.event()
                .result(finalResult)
                .duration(duration)
                .retryCount(finalResult.getRetryCount())
                .error(finalResult.getError())
                .errorType(finalResult.getErrorType())
                .build();

        Mono<Void> outcomeHooks = finalResult.isSuccess()
                ? hookRegistry.fire(HookType.ON_SUCCESS, event)
                        .then(hookRegistry.fire(
                                finalResult.isFromCache() ? HookType.ON_CACHE_HIT : HookType.ON_CACHE_MISS, event))
                : hookRegistry.fire(HookType.ON_FAILURE, event)
                        .then(Mono.<Void>fromRunnable(() -> {
                            if (config.isErrorAggregationEnabled()) {
                                accounting.recordError(scope.toolName(), finalResult, duration);
                            }
                        }));
        Mono<Void> retryHooks = finalResult.getRetryCount() > 0
                ? hookRegistry.fire(HookType.ON_RETRY, event)
                : Mono.empty();

        return hookRegistry.fire(HookType.POST_EXECUTION, event)
                .then(outcomeHooks)
                .then(retryHooks)
                .then(Mono.<Void>fromRunnable(() -> account(scope, finalResult, duration)))
                .thenReturn(finalResult);
    }

    private void account(ExecutionScope scope, ToolResult result, Duration duration) {
        if (config.isExecutionTrackingEnabled()) {
            accounting.recordExecution(scope.toolName(), result);
        }
        if (config.isPerformanceMonitoringEnabled()) {
            accounting.recordPerformance(scope.toolName(), duration);
        }
        if (config.isReplayEnabled()) {
            accounting.recordHistory(scope.toolName(), scope.executionId(), scope.input(), scope.context(),
                    result, duration);
        }
        Timer.builder("dispatch.tool.execution")
                .tag("tool", scope.toolName())
                .tag("outcome", result.isSuccess() ? "success" : "failure")
                .register(meterRegistry)
                .record(duration);
    }

    public ExecutionStatistics getExecutionStatistics() {
        Map<String, ToolExecutionCounts> counts = accounting.executionCounts();
        Map<String, Double> successRates = new LinkedHashMap<>();
        counts.forEach((tool, c) -> successRates.put(tool, c.successRate()));
        return new ExecutionStatistics(
                counts,
                activeExecutions.size(),
                counts.size(),
                accounting.errorFrequencies(),
                hookRegistry.getHookCounts(),
                successRates,
                accounting.performanceStats());
    }

    public ErrorAnalysis getErrorAnalysis() {
        return accounting.errorAnalysis();
    }

    public Map<String, ActiveExecution> getActiveExecutions() {
        return Map.copyOf(activeExecutions);
    }

    public List<ExecutionHistoryEntry> getExecutionHistory(int limit) {
        return accounting.history(limit);
    }

    public int getAvailableSlots() {
        return limiter.availablePermits();
    }

    public int getMaxConcurrentExecutions() {
        return limiter.maxPermits();
    }

    /**
     * Look up a recorded execution for replay.
     *
     * @throws ExecutionReplayException if replay is disabled
     */
    public Optional<ExecutionHistoryEntry> findReplayableExecution(String executionId) {
        if (!config.isReplayEnabled()) {
            throw new ExecutionReplayException("Execution replay is disabled");
        }
        return accounting.findHistory(executionId);
    }

    /**
     * Replay a recorded execution. Completes empty when the execution is not in history.
     */
    public Mono<ToolResult> replayExecution(String executionId) {
        return Mono.defer(() -> {
            Optional<ExecutionHistoryEntry> entry = findReplayableExecution(executionId);
            if (entry.isEmpty()) {
                log.warn("Execution {} not found in history", executionId);
                return Mono.empty();
            }
            return Mono.error(new UnsupportedOperationException(
                    "Replay of execution " + executionId + " is not implemented"));
        });
    }

    /**
     * Roll back a recorded execution. Completes empty when the execution is not in history.
     */
    public Mono<Void> rollbackExecution(String executionId) {
        return Mono.defer(() -> {
            if (!config.isRollbackEnabled()) {
                return Mono.error(new ExecutionReplayException("Execution rollback is disabled"));
            }
            if (accounting.findHistory(executionId).isEmpty()) {
                log.warn("Execution {} not found in history", executionId);
                return Mono.empty();
            }
            return Mono.error(new UnsupportedOperationException(
                    "Rollback of execution " + executionId + " is not implemented"));
        });
    }

    /**
     * Reset history, counters, error patterns and performance series.
     */
    public void clear() {
        accounting.clear();
    }

    static String generateExecutionId(String toolName) {
        return toolName + "_" + UUID.randomUUID();
    }

    private static String safeName(Tool tool) {
        try {
            return tool != null ? tool.getName() : "null";
        } catch (RuntimeException e) {
            return tool.getClass().getSimpleName();
        }
    }

    /**
     * Per-call data shared across lifecycle stages.
     */
    private record ExecutionScope(
            Tool tool,
            String toolName,
            String executionId,
            Map<String, Object> input,
            Map<String, Object> context,
            long startNanos) {

        ExecutionScope(Tool tool, String toolName, String executionId,
                       Map<String, Object> input, Map<String, Object> context) {
            this(tool, toolName, executionId, input, context, System.nanoTime());
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        HookEvent.HookEventBuilder event() {
            return HookEvent.builder()
                    .executionId(executionId)
                    .toolName(toolName)
                    .input(input)
                    .context(context);
        }
    }
}
