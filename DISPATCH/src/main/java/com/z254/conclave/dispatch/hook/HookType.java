package com.z254.conclave.dispatch.hook;

/**
 * Lifecycle events of an intercepted execution.
 */
public enum HookType {
    PRE_EXECUTION,
    POST_EXECUTION,
    ON_SUCCESS,
    ON_FAILURE,
    ON_RETRY,
    ON_TIMEOUT,
    ON_CACHE_HIT,
    ON_CACHE_MISS,
    ON_VALIDATION_ERROR,
    ON_CIRCUIT_OPEN
}
