package com.z254.conclave.dispatch.hook;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Binds {@link InvocationTelemetryListener} beans to the post-execution hook.
 */
@Component
@Slf4j
public class TelemetryHookRegistrar {

    static final int TELEMETRY_PRIORITY = 500;

    private final HookRegistry hookRegistry;
    private final List<InvocationTelemetryListener> listeners;

    public TelemetryHookRegistrar(
            HookRegistry hookRegistry,
            ObjectProvider<InvocationTelemetryListener> listeners) {
        this.hookRegistry = hookRegistry;
        this.listeners = listeners.orderedStream().toList();
    }

    @PostConstruct
    public void register() {
        if (listeners.isEmpty()) {
            log.debug("No telemetry listeners configured");
            return;
        }
        hookRegistry.register(HookType.POST_EXECUTION,
                HookHandler.suspending(event -> Flux.fromIterable(listeners)
                        .concatMap(listener -> Mono.defer(() -> listener.onExecutionCompleted(event))
                                .onErrorResume(e -> {
                                    log.warn("Telemetry listener {} failed for execution {}: {}",
                                            listener.getClass().getSimpleName(), event.getExecutionId(),
                                            e.getMessage());
                                    return Mono.empty();
                                }))
                        .then()),
                TELEMETRY_PRIORITY);
        log.info("Registered {} telemetry listener(s) on post-execution", listeners.size());
    }
}
