package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.support.CoordinationHarness;
import com.z254.conclave.dispatch.support.DispatchFixtures;
import com.z254.conclave.dispatch.support.TestTool;
import com.z254.conclave.dispatch.tool.ErrorTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LoadBalancedStrategyTest {

    private CoordinationHarness harness;
    private LoadBalancedStrategy strategy;
    private CoordinationTask task;

    @BeforeEach
    void setUp() {
        harness = new CoordinationHarness();
        strategy = new LoadBalancedStrategy(harness.getDispatcher());
        task = CoordinationTask.builder()
                .taskId("case-4:device_check")
                .complexity(0.6)
                .requiredCapability("device_fingerprinting")
                .build();
    }

    @Test
    @DisplayName("should route to the most available agent")
    void routesToMostAvailable() {
        // Given
        AgentCapabilities loaded = DispatchFixtures.agent("loaded", 2, 0.95, 0.0, "device_fingerprinting");
        AgentCapabilities idle = DispatchFixtures.agent("idle", 2, 0.95, 0.0, "device_fingerprinting");
        loaded.tryAcquireSlot();
        harness.bind("idle", TestTool.succeeding("idle_tool", "fingerprint"));

        // When
        CoordinationResult result = strategy.coordinate(List.of(loaded, idle), task).block();

        // Then
        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.COMPLETED);
        assertThat(result.getSelectedAgents()).containsExactly("idle");
        assertThat(result.getFinalOutput()).isEqualTo("fingerprint");
        assertThat(result.getConfidence()).isEqualTo(0.95);
        assertThat(result.getAttributes())
                .containsEntry("load_before", 0)
                .containsEntry("load_after", 0);
        assertThat(idle.getCurrentLoad()).isZero();
    }

    @Test
    @DisplayName("should report all agents busy when the best agent is full")
    void bestAgentFull() {
        AgentCapabilities only = DispatchFixtures.agent("only", 1, 1.0, 0.0, "device_fingerprinting");
        TestTool tool = harness.bind("only", TestTool.succeeding("only_tool", "x"));
        only.tryAcquireSlot();

        CoordinationResult result = strategy.coordinate(List.of(only), task).block();

        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.ALL_AGENTS_BUSY);
        assertThat(tool.invocations()).isZero();
        assertThat(only.getCurrentLoad()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail with zero confidence when the agent fails")
    void agentFails() {
        AgentCapabilities agent = DispatchFixtures.agent("flaky", 2, 0.9, 0.0, "device_fingerprinting");
        harness.bind("flaky", TestTool.failing("flaky_tool", "no device"));

        CoordinationResult result = strategy.coordinate(List.of(agent), task).block();

        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.FAILED);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getMessage()).isEqualTo("no device");
    }

    @Test
    @DisplayName("should fail when the agent has no worker")
    void noWorker() {
        AgentCapabilities agent = DispatchFixtures.agent("unbound", 2, 0.9, 0.0, "device_fingerprinting");

        CoordinationResult result = strategy.coordinate(List.of(agent), task).block();

        assertThat(result.getStatus()).isEqualTo(CoordinationStatus.FAILED);
        assertThat(result.getOutcomes().get(0).getErrorType()).isEqualTo(ErrorTypes.NO_WORKER);
    }
}
