package com.z254.conclave.dispatch.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Result of a tool execution.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    /**
     * Whether execution was successful.
     */
    private boolean success;

    /**
     * Whether the output was served from a cache.
     */
    private boolean fromCache;

    /**
     * Result payload.
     */
    private Object output;

    /**
     * Error message (for failed executions).
     */
    private String error;

    /**
     * Error type (for failed executions).
     */
    private String errorType;

    /**
     * Execution duration. Filled in by the interceptor when the tool leaves it empty.
     */
    private Duration duration;

    /**
     * Number of retries the tool performed internally.
     */
    private int retryCount;

    public static ToolResult success(Object output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult cached(Object output) {
        return ToolResult.builder()
                .success(true)
                .fromCache(true)
                .output(output)
                .build();
    }

    /**
     * Create a business failure result.
     */
    public static ToolResult failure(String error) {
        return failure(ErrorTypes.TOOL_FAILURE, error);
    }

    public static ToolResult failure(String errorType, String error) {
        return ToolResult.builder()
                .success(false)
                .errorType(errorType)
                .error(error)
                .build();
    }

    /**
     * Create a timeout result.
     */
    public static ToolResult timeout(Duration timeout, Duration elapsed) {
        String error = timeout != null
                ? "Tool execution timed out after " + formatSeconds(timeout) + "s"
                : "Tool execution timed out";
        return ToolResult.builder()
                .success(false)
                .errorType(ErrorTypes.TIMEOUT)
                .error(error)
                .duration(elapsed)
                .build();
    }

    public static ToolResult interceptorError(String message, Duration elapsed) {
        return ToolResult.builder()
                .success(false)
                .errorType(ErrorTypes.INTERCEPTOR)
                .error("Interceptor error: " + message)
                .duration(elapsed)
                .build();
    }

    private static String formatSeconds(Duration duration) {
        return String.valueOf(duration.toMillis() / 1000.0);
    }
}
