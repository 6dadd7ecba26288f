package com.z254.conclave.dispatch.hook;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Map;

/**
 * A registered lifecycle callback. Only {@code enabled} may change after registration.
 */
@Getter
@Builder
@ToString
public class InterceptorHook {

    public static final int DEFAULT_PRIORITY = 100;

    private final HookType hookType;

    private final HookHandler handler;

    /**
     * Lower values run first.
     */
    @Builder.Default
    private final int priority = DEFAULT_PRIORITY;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    @Setter
    @Builder.Default
    private volatile boolean enabled = true;

    public static InterceptorHook of(HookType hookType, HookHandler handler) {
        return of(hookType, handler, DEFAULT_PRIORITY);
    }

    public static InterceptorHook of(HookType hookType, HookHandler handler, int priority) {
        return InterceptorHook.builder()
                .hookType(hookType)
                .handler(handler)
                .priority(priority)
                .build();
    }

    public boolean isAsync() {
        return handler != null && handler.mode() == HookHandler.Mode.SUSPENDING;
    }
}
