package com.z254.conclave.dispatch.hook;

import com.z254.conclave.dispatch.tool.ToolResult;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Map;

/**
 * Payload passed to hook handlers.
 */
@Value
@Builder(toBuilder = true)
public class HookEvent {

    @With
    HookType hookType;

    String executionId;

    String toolName;

    Map<String, Object> input;

    Map<String, Object> context;

    /**
     * Result of the execution. Null for events fired before the tool ran.
     */
    ToolResult result;

    Duration duration;

    int retryCount;

    /**
     * Timeout bound that fired, for {@link HookType#ON_TIMEOUT}.
     */
    Duration timeout;

    String error;

    String errorType;
}
