package com.z254.conclave.dispatch.tool;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A unit of work the interceptor can wrap.
 * Tools are invoked by the execution interceptor, either directly or on behalf of an agent.
 */
public interface Tool {

    /**
     * Get the tool name. Used in execution ids, error pattern keys and statistics.
     *
     * @return tool name
     */
    String getName();

    /**
     * Execute the tool.
     *
     * @param input tool input
     * @param context execution context; always contains {@code execution_id}
     * @return tool result
     */
    Mono<ToolResult> execute(Map<String, Object> input, Map<String, Object> context);

    /**
     * Timeout bound applied by the interceptor. {@code null} means unbounded.
     *
     * @return timeout or null
     */
    default Duration getTimeout() {
        return null;
    }

    /**
     * Validate input before execution.
     *
     * @param input the input to validate
     * @return validation result
     */
    default Mono<ValidationResult> validate(Map<String, Object> input) {
        return Mono.just(ValidationResult.success());
    }

    /**
     * Validation result.
     */
    record ValidationResult(boolean valid, List<String> errors) {

        public static ValidationResult success() {
            return new ValidationResult(true, List.of());
        }

        public static ValidationResult failure(String... errors) {
            return new ValidationResult(false, List.of(errors));
        }

        public static ValidationResult failure(List<String> errors) {
            return new ValidationResult(false, List.copyOf(errors));
        }
    }
}
