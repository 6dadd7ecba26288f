package com.z254.conclave.dispatch.hook;

import reactor.core.publisher.Mono;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Callback attached to a hook.
 * A handler is either synchronous (run on the hook worker pool) or suspending
 * (returns a {@link Mono} that the registry awaits).
 */
public interface HookHandler {

    Mode mode();

    static HookHandler sync(Consumer<HookEvent> action) {
        return new Sync(action);
    }

    static HookHandler suspending(Function<HookEvent, Mono<Void>> action) {
        return new Suspending(action);
    }

    enum Mode {
        SYNC,
        SUSPENDING
    }

    record Sync(Consumer<HookEvent> action) implements HookHandler {

        public Sync {
            if (action == null) {
                throw new HookValidationException("Synchronous hook action must not be null");
            }
        }

        @Override
        public Mode mode() {
            return Mode.SYNC;
        }
    }

    record Suspending(Function<HookEvent, Mono<Void>> action) implements HookHandler {

        public Suspending {
            if (action == null) {
                throw new HookValidationException("Suspending hook action must not be null");
            }
        }

        @Override
        public Mode mode() {
            return Mode.SUSPENDING;
        }
    }
}
