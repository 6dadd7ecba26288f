package com.z254.conclave.dispatch.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Random;

/**
 * Infrastructure beans shared by the interceptor and the coordination strategies.
 */
@Configuration
@Slf4j
public class DispatchConfig {

    public static final String HOOK_SCHEDULER = "hookScheduler";
    public static final String COORDINATION_RANDOM = "coordinationRandom";

    /**
     * Bounded worker pool that runs synchronous hook handlers.
     */
    @Bean(name = HOOK_SCHEDULER, destroyMethod = "dispose")
    public Scheduler hookScheduler(DispatchProperties properties) {
        DispatchProperties.HookProperties hooks = properties.getHooks();
        return Schedulers.newBoundedElastic(
                hooks.getWorkerThreads(), hooks.getWorkerQueueCapacity(), "dispatch-hook");
    }

    /**
     * Random source for committee voter sampling. Seeded when a seed is configured.
     */
    @Bean(name = COORDINATION_RANDOM)
    public Random coordinationRandom(DispatchProperties properties) {
        Long seed = properties.getCoordination().getSamplingSeed();
        if (seed != null) {
            log.info("Committee voter sampling seeded with {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    public CircuitBreakerRegistry toolCircuitBreakerRegistry(DispatchProperties properties) {
        return CircuitBreakerRegistry.of(circuitBreakerConfig(properties.getCircuitBreaker()));
    }

    public static CircuitBreakerConfig circuitBreakerConfig(DispatchProperties.CircuitBreakerProperties config) {
        return CircuitBreakerConfig.custom()
                .failureRateThreshold(config.getFailureRateThreshold())
                .slidingWindowSize(config.getSlidingWindowSize())
                .minimumNumberOfCalls(config.getMinimumNumberOfCalls())
                .waitDurationInOpenState(config.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(config.getPermittedCallsInHalfOpenState())
                .build();
    }
}
