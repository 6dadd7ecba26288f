package com.z254.conclave.dispatch.interceptor;

/**
 * Thrown when replay or rollback is requested while the feature is disabled.
 */
public class ExecutionReplayException extends IllegalStateException {

    public ExecutionReplayException(String message) {
        super(message);
    }
}
