package com.z254.conclave.dispatch.hook;

import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.support.DispatchFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HookRegistry}.
 */
class HookRegistryTest {

    private DispatchProperties properties;
    private MeterRegistry meterRegistry;
    private HookRegistry registry;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        properties = DispatchFixtures.properties();
        properties.getHooks().setTimeout(Duration.ofMillis(200));
        meterRegistry = new SimpleMeterRegistry();
        registry = DispatchFixtures.hookRegistry(properties, meterRegistry);
        fired = new CopyOnWriteArrayList<>();
    }

    private HookEvent event() {
        return HookEvent.builder()
                .executionId("search_1")
                .toolName("search")
                .build();
    }

    private HookHandler recording(String label) {
        return HookHandler.sync(event -> fired.add(label));
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should fire hooks in ascending priority order")
        void firesInPriorityOrder() {
            registry.register(HookType.PRE_EXECUTION, recording("50"), 50);
            registry.register(HookType.PRE_EXECUTION, recording("1"), 1);
            registry.register(HookType.PRE_EXECUTION, recording("100"), 100);

            registry.fire(HookType.PRE_EXECUTION, event()).block();

            assertThat(fired).containsExactly("1", "50", "100");
        }

        @Test
        @DisplayName("should keep registration order for equal priorities")
        void keepsRegistrationOrderForTies() {
            registry.register(HookType.ON_SUCCESS, recording("a"), 10);
            registry.register(HookType.ON_SUCCESS, recording("b"), 10);
            registry.register(HookType.ON_SUCCESS, recording("c"), 5);
            registry.register(HookType.ON_SUCCESS, recording("d"), 10);

            registry.fire(HookType.ON_SUCCESS, event()).block();

            assertThat(fired).containsExactly("c", "a", "b", "d");
            assertThat(registry.getHooks(HookType.ON_SUCCESS))
                    .extracting(InterceptorHook::getPriority)
                    .containsExactly(5, 10, 10, 10);
        }

        @Test
        @DisplayName("should await suspending and synchronous hooks in one sequence")
        void mixesHandlerKinds() {
            registry.register(HookType.POST_EXECUTION, HookHandler.suspending(event ->
                    Mono.delay(Duration.ofMillis(30)).then(Mono.fromRunnable(() -> fired.add("slow")))), 1);
            registry.register(HookType.POST_EXECUTION, recording("sync"), 2);

            registry.fire(HookType.POST_EXECUTION, event()).block();

            assertThat(fired).containsExactly("slow", "sync");
        }

        @Test
        @DisplayName("should pass the fired hook type to handlers")
        void passesHookType() {
            AtomicReference<HookType> seen = new AtomicReference<>();
            registry.register(HookType.ON_CACHE_HIT, HookHandler.sync(event -> seen.set(event.getHookType())), 1);

            registry.fire(HookType.ON_CACHE_HIT, event()).block();

            assertThat(seen.get()).isEqualTo(HookType.ON_CACHE_HIT);
        }

        @Test
        @DisplayName("should run synchronous handlers on the hook worker pool")
        void runsSyncHandlersOffCallerThread() {
            AtomicReference<String> thread = new AtomicReference<>();
            registry.register(HookType.PRE_EXECUTION,
                    HookHandler.sync(event -> thread.set(Thread.currentThread().getName())), 1);

            registry.fire(HookType.PRE_EXECUTION, event()).block();

            assertThat(thread.get()).startsWith("boundedElastic");
        }
    }

    @Nested
    @DisplayName("Failure containment")
    class ContainmentTests {

        @Test
        @DisplayName("should continue after a hook throws")
        void continuesAfterThrowingHook() {
            registry.register(HookType.ON_FAILURE, HookHandler.sync(event -> {
                throw new IllegalStateException("boom");
            }), 1);
            registry.register(HookType.ON_FAILURE, recording("after"), 2);

            StepVerifier.create(registry.fire(HookType.ON_FAILURE, event()))
                    .verifyComplete();

            assertThat(fired).containsExactly("after");
            assertThat(meterRegistry.counter("dispatch.hook.failures").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should continue after a suspending hook errors or returns null")
        void containsSuspendingFailures() {
            registry.register(HookType.ON_FAILURE,
                    HookHandler.suspending(event -> Mono.error(new IllegalArgumentException("bad"))), 1);
            registry.register(HookType.ON_FAILURE, HookHandler.suspending(event -> null), 2);
            registry.register(HookType.ON_FAILURE, recording("last"), 3);

            StepVerifier.create(registry.fire(HookType.ON_FAILURE, event()))
                    .verifyComplete();

            assertThat(fired).containsExactly("last");
        }

        @Test
        @DisplayName("should skip a hook that exceeds the hook timeout")
        void skipsTimedOutHook() {
            registry.register(HookType.PRE_EXECUTION, HookHandler.suspending(event -> Mono.never()), 1);
            registry.register(HookType.PRE_EXECUTION, recording("next"), 2);

            StepVerifier.create(registry.fire(HookType.PRE_EXECUTION, event()))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(fired).containsExactly("next");
            assertThat(meterRegistry.counter("dispatch.hook.timeouts").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should reject hooks without handler or type")
        void rejectsInvalidHooks() {
            assertThatThrownBy(() -> registry.register(InterceptorHook.builder()
                    .hookType(HookType.PRE_EXECUTION)
                    .build()))
                    .isInstanceOf(HookValidationException.class);
            assertThatThrownBy(() -> registry.register(InterceptorHook.builder()
                    .handler(recording("x"))
                    .build()))
                    .isInstanceOf(HookValidationException.class);
            assertThatThrownBy(() -> HookHandler.sync(null))
                    .isInstanceOf(HookValidationException.class);
        }

        @Test
        @DisplayName("should remove only the first matching hook")
        void unregisterRemovesFirstMatch() {
            HookHandler handler = recording("dup");
            registry.register(HookType.ON_RETRY, handler, 1);
            registry.register(HookType.ON_RETRY, handler, 2);

            assertThat(registry.unregister(HookType.ON_RETRY, handler)).isTrue();
            registry.fire(HookType.ON_RETRY, event()).block();

            assertThat(fired).containsExactly("dup");
            assertThat(registry.getHooks(HookType.ON_RETRY))
                    .extracting(InterceptorHook::getPriority)
                    .containsExactly(2);
        }

        @Test
        @DisplayName("should report false when nothing matches")
        void unregisterUnknown() {
            assertThat(registry.unregister(HookType.ON_TIMEOUT, recording("none"))).isFalse();
        }

        @Test
        @DisplayName("should skip disabled hooks")
        void skipsDisabledHooks() {
            HookHandler handler = recording("disabled");
            registry.register(HookType.ON_SUCCESS, handler, 1);
            registry.register(HookType.ON_SUCCESS, recording("enabled"), 2);

            assertThat(registry.setEnabled(HookType.ON_SUCCESS, handler, false)).isEqualTo(1);
            registry.fire(HookType.ON_SUCCESS, event()).block();

            assertThat(fired).containsExactly("enabled");
            assertThat(registry.getHookCounts()).containsEntry(HookType.ON_SUCCESS, 2);
        }

        @Test
        @DisplayName("should fire nothing when hooks are globally disabled")
        void honorsGlobalSwitch() {
            registry.register(HookType.ON_SUCCESS, recording("never"), 1);
            properties.getHooks().setEnabled(false);

            registry.fire(HookType.ON_SUCCESS, event()).block();

            assertThat(fired).isEmpty();
        }

        @Test
        @DisplayName("should report counts for every hook type")
        void countsEveryType() {
            registry.register(HookType.ON_TIMEOUT, recording("t"), 1);

            assertThat(registry.getHookCounts())
                    .hasSize(HookType.values().length)
                    .containsEntry(HookType.ON_TIMEOUT, 1)
                    .containsEntry(HookType.PRE_EXECUTION, 0);
        }
    }
}
