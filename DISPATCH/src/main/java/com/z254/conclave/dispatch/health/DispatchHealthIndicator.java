package com.z254.conclave.dispatch.health;

import com.z254.conclave.dispatch.agent.AgentCapabilityPool;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.interceptor.ToolExecutionInterceptor;
import com.z254.conclave.dispatch.resilience.ToolCircuitBreakers;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for the DISPATCH service.
 * Reports execution slot usage, agent pool capacity and open circuit breakers.
 * DOWN when no agent is registered.
 */
@Component
@Slf4j
public class DispatchHealthIndicator implements ReactiveHealthIndicator {

    private final ToolExecutionInterceptor interceptor;
    private final AgentCapabilityPool pool;
    private final ToolCircuitBreakers circuitBreakers;

    public DispatchHealthIndicator(
            ToolExecutionInterceptor interceptor,
            AgentCapabilityPool pool,
            ToolCircuitBreakers circuitBreakers) {
        this.interceptor = interceptor;
        this.pool = pool;
        this.circuitBreakers = circuitBreakers;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::buildHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down().withException(e).build());
                });
    }

    private Health buildHealth() {
        List<AgentCapabilities> agents = pool.getAll();
        int capacity = agents.stream().mapToInt(AgentCapabilities::getMaxConcurrentTasks).sum();
        int load = agents.stream().mapToInt(AgentCapabilities::getCurrentLoad).sum();
        Map<String, CircuitBreaker.State> breakers = circuitBreakers.states();
        List<String> openCircuits = breakers.entrySet().stream()
                .filter(e -> e.getValue() == CircuitBreaker.State.OPEN)
                .map(Map.Entry::getKey)
                .toList();

        Health.Builder builder = agents.isEmpty() ? Health.down() : Health.up();
        builder.withDetail("activeExecutions", interceptor.getActiveExecutions().size());
        builder.withDetail("availableExecutionSlots", interceptor.getAvailableSlots());
        builder.withDetail("maxConcurrentExecutions", interceptor.getMaxConcurrentExecutions());
        builder.withDetail("agents", agents.size());
        builder.withDetail("availableAgents", pool.getAvailableAgents().size());
        builder.withDetail("agentLoad", load);
        builder.withDetail("agentCapacity", capacity);
        builder.withDetail("openCircuits", openCircuits);
        return builder.build();
    }
}
