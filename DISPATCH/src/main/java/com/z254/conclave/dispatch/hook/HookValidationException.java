package com.z254.conclave.dispatch.hook;

/**
 * Thrown when a hook cannot be registered.
 */
public class HookValidationException extends IllegalArgumentException {

    public HookValidationException(String message) {
        super(message);
    }
}
