package com.z254.conclave.dispatch.hook;

import com.z254.conclave.dispatch.config.DispatchConfig;
import com.z254.conclave.dispatch.config.DispatchProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Registry of lifecycle hooks.
 * Hooks of one type run in ascending priority order; equal priorities keep registration order.
 * Firing is best-effort: a hook that fails or times out is logged and skipped.
 */
@Component
@Slf4j
public class HookRegistry {

    private final DispatchProperties.HookProperties config;
    private final Scheduler hookScheduler;
    private final Counter hookFailureCounter;
    private final Counter hookTimeoutCounter;

    // Immutable snapshots, replaced on every change
    private final Map<HookType, List<RegisteredHook>> hooks = new ConcurrentHashMap<>();

    public HookRegistry(
            DispatchProperties dispatchProperties,
            @Qualifier(DispatchConfig.HOOK_SCHEDULER) Scheduler hookScheduler,
            MeterRegistry meterRegistry) {
        this.config = dispatchProperties.getHooks();
        this.hookScheduler = hookScheduler;
        this.hookFailureCounter = Counter.builder("dispatch.hook.failures")
                .register(meterRegistry);
        this.hookTimeoutCounter = Counter.builder("dispatch.hook.timeouts")
                .register(meterRegistry);
    }

    /**
     * Register a hook.
     *
     * @throws HookValidationException if the hook has no type or handler
     */
    public InterceptorHook register(InterceptorHook hook) {
        if (hook == null || hook.getHookType() == null) {
            throw new HookValidationException("Hook type must not be null");
        }
        if (hook.getHandler() == null) {
            throw new HookValidationException("Hook handler must not be null for " + hook.getHookType());
        }

        RegisteredHook registered = new RegisteredHook(hook, bind(hook.getHandler()));
        hooks.compute(hook.getHookType(), (type, current) -> {
            List<RegisteredHook> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(registered);
            // List.sort is stable
            updated.sort(Comparator.comparingInt(r -> r.hook().getPriority()));
            return List.copyOf(updated);
        });

        log.debug("Registered {} hook (priority {}, async {})",
                hook.getHookType(), hook.getPriority(), hook.isAsync());
        return hook;
    }

    public InterceptorHook register(HookType type, HookHandler handler, int priority) {
        return register(InterceptorHook.of(type, handler, priority));
    }

    /**
     * Remove the first hook of the given type with the given handler.
     *
     * @return true if a hook was removed
     */
    public boolean unregister(HookType type, HookHandler handler) {
        boolean[] removed = {false};
        hooks.computeIfPresent(type, (key, current) -> {
            List<RegisteredHook> updated = new ArrayList<>(current);
            for (int i = 0; i < updated.size(); i++) {
                if (updated.get(i).hook().getHandler().equals(handler)) {
                    updated.remove(i);
                    removed[0] = true;
                    break;
                }
            }
            return List.copyOf(updated);
        });
        if (removed[0]) {
            log.debug("Unregistered {} hook", type);
        }
        return removed[0];
    }

    /**
     * Enable or disable every hook of the given type bound to the given handler.
     *
     * @return number of hooks updated
     */
    public int setEnabled(HookType type, HookHandler handler, boolean enabled) {
        int updated = 0;
        for (RegisteredHook registered : snapshot(type)) {
            if (registered.hook().getHandler().equals(handler)) {
                registered.hook().setEnabled(enabled);
                updated++;
            }
        }
        return updated;
    }

    /**
     * Hooks of a type in firing order.
     */
    public List<InterceptorHook> getHooks(HookType type) {
        return snapshot(type).stream()
                .map(RegisteredHook::hook)
                .toList();
    }

    public Map<HookType, Integer> getHookCounts() {
        Map<HookType, Integer> counts = new EnumMap<>(HookType.class);
        for (HookType type : HookType.values()) {
            counts.put(type, snapshot(type).size());
        }
        return counts;
    }

    /**
     * Fire all enabled hooks of a type, in order.
     * The returned Mono completes once every hook has finished, failed or timed out; it never errors.
     */
    public Mono<Void> fire(HookType type, HookEvent event) {
        return Mono.defer(() -> {
            if (!config.isEnabled()) {
                return Mono.empty();
            }
            List<RegisteredHook> registered = snapshot(type);
            if (registered.isEmpty()) {
                return Mono.empty();
            }

            HookEvent typedEvent = event.withHookType(type);
            return Flux.fromIterable(registered)
                    .filter(r -> r.hook().isEnabled())
                    .concatMap(r -> invoke(r, typedEvent))
                    .then();
        });
    }

    private Mono<Void> invoke(RegisteredHook registered, HookEvent event) {
        Duration timeout = config.getTimeout();
        return Mono.defer(() -> registered.invoker().apply(event))
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, e -> {
                    hookTimeoutCounter.increment();
                    log.warn("{} hook (priority {}) timed out after {} for execution {}",
                            event.getHookType(), registered.hook().getPriority(), timeout, event.getExecutionId());
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    hookFailureCounter.increment();
                    log.error("{} hook (priority {}) failed for execution {}: {}",
                            event.getHookType(), registered.hook().getPriority(), event.getExecutionId(),
                            e.getMessage(), e);
                    return Mono.empty();
                });
    }

    private Function<HookEvent, Mono<Void>> bind(HookHandler handler) {
        return switch (handler.mode()) {
            case SYNC -> {
                Consumer<HookEvent> action = ((HookHandler.Sync) handler).action();
                yield event -> Mono.<Void>fromRunnable(() -> action.accept(event))
                        .subscribeOn(hookScheduler);
            }
            case SUSPENDING -> ((HookHandler.Suspending) handler).action();
        };
    }

    private List<RegisteredHook> snapshot(HookType type) {
        return hooks.getOrDefault(type, List.of());
    }

    private record RegisteredHook(InterceptorHook hook, Function<HookEvent, Mono<Void>> invoker) {
    }
}
