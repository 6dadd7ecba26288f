package com.z254.conclave.dispatch.tool;

/**
 * A failed {@link ToolResult} expressed as an exception, for components that count failures by throwable.
 */
public class ToolExecutionException extends RuntimeException {

    private final String errorType;

    public ToolExecutionException(String errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public String getErrorType() {
        return errorType;
    }
}
