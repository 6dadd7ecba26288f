package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.agent.AgentCapabilityPool;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import com.z254.conclave.dispatch.support.CoordinationHarness;
import com.z254.conclave.dispatch.support.DispatchFixtures;
import com.z254.conclave.dispatch.support.TestTool;
import com.z254.conclave.dispatch.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class CoordinationServiceTest {

    private CoordinationHarness harness;
    private AgentCapabilityPool pool;
    private AgentCapabilities analyst;
    private CoordinationService service;

    @BeforeEach
    void setUp() {
        harness = new CoordinationHarness();
        pool = new AgentCapabilityPool(harness.getProperties());
        analyst = DispatchFixtures.agent("log_analyst", 2, 0.9, 0.0, "log_parsing");
        pool.register(analyst);
        harness.bind("log_analyst", TestTool.succeeding("log_tool", "parsed"));

        AgentDispatcher dispatcher = harness.getDispatcher();
        service = new CoordinationService(pool, List.of(
                new ParallelStrategy(dispatcher),
                new SequentialStrategy(dispatcher, harness.getProperties()),
                new CommitteeStrategy(dispatcher, harness.getProperties(), new Random(1)),
                new LoadBalancedStrategy(dispatcher)), harness.getMeterRegistry());
    }

    private CoordinationTask.CoordinationTaskBuilder task() {
        return CoordinationTask.builder()
                .taskId("case-5:log_check")
                .complexity(0.5)
                .requiredCapability("log_parsing");
    }

    @Test
    @DisplayName("should default to load-balanced coordination")
    void defaultsToLoadBalanced() {
        CoordinationResult result = service.execute(task().build()).block();

        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.COMPLETED);
        assertThat(result.getStrategyName()).isEqualTo("load_balanced");
        assertThat(service.getSupportedStrategies()).containsExactlyInAnyOrder(StrategyType.values());
        assertThat(harness.getMeterRegistry().counter("dispatch.coordination.results",
                "strategy", "load_balanced", "status", "completed").count()).isEqualTo(1.0);
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        @DisplayName("should reject an invalid task without running a strategy")
        void invalidTask() {
            CoordinationResult result = service.execute(task().complexity(2.0).build(), StrategyType.PARALLEL)
                    .block();

            assertThat(result.getStatus()).isEqualTo(CoordinationStatus.INVALID_TASK);
            assertThat(result.getMessage()).contains("complexity");
        }

        @Test
        @DisplayName("should report a missing strategy")
        void unknownStrategy() {
            CoordinationService limited = new CoordinationService(pool,
                    List.of(new LoadBalancedStrategy(harness.getDispatcher())), harness.getMeterRegistry());

            assertThat(limited.execute(task().build(), StrategyType.COMMITTEE).block().getStatus())
                    .isEqualTo(CoordinationStatus.UNKNOWN_STRATEGY);
            assertThat(service.execute(task().build(), null).block().getStatus())
                    .isEqualTo(CoordinationStatus.UNKNOWN_STRATEGY);
        }

        @Test
        @DisplayName("should refuse a task whose deadline has passed")
        void pastDeadline() {
            CoordinationResult result = service.execute(
                    task().deadline(Instant.now().minusSeconds(1)).build(), StrategyType.LOAD_BALANCED).block();

            assertThat(result.getStatus()).isEqualTo(CoordinationStatus.DEADLINE_EXCEEDED);
        }
    }

    @Test
    @DisplayName("should stop coordination at the deadline and free the agent")
    void deadlineElapses() {
        // Given
        harness.bind("log_analyst", new TestTool("slow_tool",
                input -> Mono.delay(Duration.ofSeconds(5)).thenReturn(ToolResult.success("late"))));
        CoordinationTask task = task().deadline(Instant.now().plusMillis(200)).build();

        // When
        CoordinationResult result = service.execute(task, StrategyType.LOAD_BALANCED).block(Duration.ofSeconds(3));

        // Then
        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.DEADLINE_EXCEEDED);
        assertThat(analyst.getCurrentLoad()).isZero();
        assertThat(harness.getInterceptor().getActiveExecutions()).isEmpty();
    }
}
