package com.z254.conclave.dispatch.resilience;

import com.z254.conclave.dispatch.config.DispatchProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One circuit breaker per tool name.
 */
@Component
@Slf4j
public class ToolCircuitBreakers {

    private final CircuitBreakerRegistry registry;
    private final boolean enabled;

    public ToolCircuitBreakers(CircuitBreakerRegistry registry, DispatchProperties dispatchProperties) {
        this.registry = registry;
        this.enabled = dispatchProperties.getCircuitBreaker().isEnabled();
    }

    /**
     * Circuit breaker guarding a tool, or empty when circuit breaking is disabled.
     */
    public Optional<CircuitBreaker> forTool(String toolName) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.of(registry.circuitBreaker(toolName, () -> {
            log.debug("Creating circuit breaker for tool {}", toolName);
            return registry.getDefaultConfig();
        }));
    }

    public Map<String, CircuitBreaker.State> states() {
        Map<String, CircuitBreaker.State> states = new LinkedHashMap<>();
        registry.getAllCircuitBreakers()
                .forEach(breaker -> states.put(breaker.getName(), breaker.getState()));
        return states;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
