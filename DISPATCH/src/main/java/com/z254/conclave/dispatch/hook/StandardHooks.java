package com.z254.conclave.dispatch.hook;

import com.z254.conclave.dispatch.config.DispatchProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Logging hooks installed on every interceptor.
 */
@Component
@Slf4j
public class StandardHooks {

    static final int PRE_LOGGING_PRIORITY = 1;
    static final int POST_LOGGING_PRIORITY = 999;
    static final int FAILURE_LOGGING_PRIORITY = 1;
    static final int SLOW_EXECUTION_PRIORITY = 50;

    private final HookRegistry hookRegistry;
    private final DispatchProperties.HookProperties config;

    public StandardHooks(HookRegistry hookRegistry, DispatchProperties dispatchProperties) {
        this.hookRegistry = hookRegistry;
        this.config = dispatchProperties.getHooks();
    }

    @PostConstruct
    public void register() {
        if (!config.isStandardHooksEnabled()) {
            log.info("Standard interceptor hooks disabled");
            return;
        }
        hookRegistry.register(HookType.PRE_EXECUTION, HookHandler.sync(this::logStart), PRE_LOGGING_PRIORITY);
        hookRegistry.register(HookType.POST_EXECUTION, HookHandler.sync(this::logFinish), POST_LOGGING_PRIORITY);
        hookRegistry.register(HookType.ON_FAILURE, HookHandler.sync(this::logFailure), FAILURE_LOGGING_PRIORITY);
        hookRegistry.register(HookType.ON_SUCCESS, HookHandler.sync(this::warnIfSlow), SLOW_EXECUTION_PRIORITY);
        log.info("Registered standard interceptor hooks");
    }

    void logStart(HookEvent event) {
        log.info("Starting execution of {} [{}]", event.getToolName(), event.getExecutionId());
    }

    void logFinish(HookEvent event) {
        boolean success = event.getResult() != null && event.getResult().isSuccess();
        log.info("Completed execution of {} [{}] in {}ms - {}",
                event.getToolName(), event.getExecutionId(), millis(event.getDuration()),
                success ? "SUCCESS" : "FAILED");
    }

    void logFailure(HookEvent event) {
        log.error("Execution of {} [{}] failed ({}): {}",
                event.getToolName(), event.getExecutionId(), event.getErrorType(), event.getError());
    }

    void warnIfSlow(HookEvent event) {
        Duration duration = event.getDuration();
        if (duration != null && duration.compareTo(config.getSlowExecutionThreshold()) > 0) {
            log.warn("Slow execution of {} [{}]: {}ms",
                    event.getToolName(), event.getExecutionId(), duration.toMillis());
        }
    }

    private static long millis(Duration duration) {
        return duration != null ? duration.toMillis() : 0L;
    }
}
