package com.z254.conclave.dispatch.tool;

/**
 * Error types reported on {@link ToolResult#getErrorType()} by the interceptor itself.
 * Tool exceptions are reported under the exception's simple class name.
 */
public final class ErrorTypes {

    public static final String TIMEOUT = "TimeoutError";
    public static final String INTERCEPTOR = "InterceptorError";
    public static final String VALIDATION = "ValidationError";
    public static final String CIRCUIT_OPEN = "CircuitOpenError";
    public static final String TOOL_FAILURE = "ToolFailure";
    public static final String NO_WORKER = "NoWorkerBound";
    public static final String AGENT_BUSY = "AgentBusy";

    private ErrorTypes() {
    }
}
