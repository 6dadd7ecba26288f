package com.z254.conclave.dispatch.hook;

import reactor.core.publisher.Mono;

/**
 * Receives a record of every completed execution.
 * Implementations forward to an external telemetry system.
 */
public interface InvocationTelemetryListener {

    Mono<Void> onExecutionCompleted(HookEvent event);
}
