package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.agent.AgentCapabilityPool;
import com.z254.conclave.dispatch.coordination.AgentDispatcher;
import com.z254.conclave.dispatch.coordination.CommitteeStrategy;
import com.z254.conclave.dispatch.coordination.CoordinationService;
import com.z254.conclave.dispatch.coordination.LoadBalancedStrategy;
import com.z254.conclave.dispatch.coordination.ParallelStrategy;
import com.z254.conclave.dispatch.coordination.SequentialStrategy;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import com.z254.conclave.dispatch.domain.model.VoteDecision;
import com.z254.conclave.dispatch.support.CoordinationHarness;
import com.z254.conclave.dispatch.support.DispatchFixtures;
import com.z254.conclave.dispatch.support.TestTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class InvestigationOrchestratorTest {

    private CoordinationHarness harness;
    private AgentCapabilityPool pool;
    private InvestigationOrchestrator orchestrator;
    private TestTool deviceTool;

    @BeforeEach
    void setUp() {
        harness = new CoordinationHarness();
        pool = new AgentCapabilityPool(harness.getProperties());
        AgentDispatcher dispatcher = harness.getDispatcher();
        CoordinationService service = new CoordinationService(pool, List.of(
                new ParallelStrategy(dispatcher),
                new SequentialStrategy(dispatcher, harness.getProperties()),
                new CommitteeStrategy(dispatcher, harness.getProperties(), new Random(11)),
                new LoadBalancedStrategy(dispatcher)), harness.getMeterRegistry());
        orchestrator = new InvestigationOrchestrator(service, pool, harness.getProperties());

        pool.register(DispatchFixtures.agent("device_analyst", 3, 0.95, 1.2, "device_fingerprinting"));
        pool.register(DispatchFixtures.agent("network_analyst", 2, 0.88, 2.1, "network_forensics"));
        pool.register(DispatchFixtures.agent("log_analyst", 5, 0.92, 0.8, "log_parsing"));
        deviceTool = harness.bind("device_analyst", TestTool.echoing("device_tool"));
        harness.bind("network_analyst", TestTool.echoing("network_tool"));
        harness.bind("log_analyst", TestTool.echoing("log_tool"));
        for (int i = 1; i <= 3; i++) {
            String name = "risk_assessor_" + i;
            pool.register(DispatchFixtures.agent(name, 4, 0.9, 1.5, "risk_scoring", "fraud_detection"));
            harness.bind(name, TestTool.succeeding(name + "_tool", "approve"));
        }
        pool.register(DispatchFixtures.agent("decision_maker", 2, 0.96, 3.0,
                "decision_synthesis", "recommendation"));
        harness.bind("decision_maker", TestTool.succeeding("decision_tool", Map.of("verdict", "clear")));
    }

    @Nested
    @DisplayName("Investigation")
    class InvestigationTests {

        @Test
        @DisplayName("should run gathering, assessment and synthesis in order")
        void runsThreePhases() {
            // When
            InvestigationReport report = orchestrator.investigate("case-9",
                    Map.of("device", Map.of("id", "d-1"), "network", Map.of("ip", "10.1.1.1"))).block();

            // Then
            assertThat(report.getCaseId()).isEqualTo("case-9");
            assertThat(report.getDataGathering())
                    .extracting(CoordinationResult::getTaskId)
                    .containsExactly("case-9:device_check", "case-9:network_check", "case-9:log_check");
            assertThat(report.getDataGathering()).allMatch(CoordinationResult::isCompleted);
            assertThat(report.getRiskAssessment().getDecision()).isEqualTo(VoteDecision.APPROVE);
            assertThat(report.getFinalDecision().getStatus()).isEqualTo(CoordinationStatus.COMPLETED);
            assertThat(report.getFinalDecision().getFinalOutput()).isEqualTo(Map.of("verdict", "clear"));
            assertThat(report.getCoordinationMetrics().tasksCompleted()).isEqualTo(5);
            assertThat(report.getCoordinationMetrics().ledgerSize()).isEqualTo(5);
            assertThat(report.getCoordinationMetrics().totalAgentsInvolved()).isEqualTo(pool.size());
            assertThat(report.getCoordinationMetrics().strategiesUsed())
                    .containsExactly(StrategyType.PARALLEL, StrategyType.COMMITTEE, StrategyType.SEQUENTIAL);
        }

        @Test
        @DisplayName("should hand each gathering task its slice of the case data")
        void passesCaseData() {
            orchestrator.investigate("case-10", Map.of("device", Map.of("id", "d-2"))).block();

            assertThat(deviceTool.lastInput())
                    .containsEntry(InvestigationOrchestrator.CASE_ID_KEY, "case-10")
                    .containsEntry("device_data", Map.of("id", "d-2"));
        }

        @Test
        @DisplayName("should still report when a phase cannot be staffed")
        void reportsUnstaffedPhase() {
            for (int i = 1; i <= 3; i++) {
                pool.unregister("risk_assessor_" + i);
            }

            InvestigationReport report = orchestrator.investigate("case-11", null).block();

            assertThat(report.getRiskAssessment().getStatus()).isEqualTo(CoordinationStatus.NO_AGENTS_AVAILABLE);
            assertThat(report.getCoordinationMetrics().tasksCompleted()).isEqualTo(4);
            assertThat(orchestrator.getLedger()).hasSize(5);
        }

        @Test
        @DisplayName("should record every coordinated task in the ledger")
        void recordsLedger() {
            orchestrator.investigate("case-12", Map.of()).block();

            assertThat(orchestrator.getLedger())
                    .extracting(LedgerEntry::strategy)
                    .containsExactly(StrategyType.PARALLEL, StrategyType.PARALLEL, StrategyType.PARALLEL,
                            StrategyType.COMMITTEE, StrategyType.SEQUENTIAL);
            assertThat(orchestrator.getLedger().get(3).task().getDependencies())
                    .containsExactly("case-12:device_check", "case-12:network_check", "case-12:log_check");
            assertThat(orchestrator.getAgentWorkloadReport()).hasSize(pool.size());
        }
    }

    @Nested
    @DisplayName("Capacity tuning")
    class CapacityTests {

        @Test
        @DisplayName("should shrink unreliable agents and grow fast reliable ones")
        void adjustsCapacity() {
            // Given
            AgentCapabilities unreliable = DispatchFixtures.agent("unreliable", 3, 0.5, 1.0, "x");
            AgentCapabilities star = DispatchFixtures.agent("star", 3, 0.99, 0.5, "x");
            AgentCapabilities slowStar = DispatchFixtures.agent("slow_star", 3, 0.99, 4.0, "x");
            AgentCapabilities floor = DispatchFixtures.agent("floor", 1, 0.2, 1.0, "x");
            AgentCapabilities ceiling = DispatchFixtures.agent("ceiling", 10, 1.0, 0.1, "x");
            List.of(unreliable, star, slowStar, floor, ceiling).forEach(pool::register);

            // When
            AllocationReport report = orchestrator.optimizeAgentAllocation();

            // Then
            assertThat(unreliable.getMaxConcurrentTasks()).isEqualTo(2);
            assertThat(star.getMaxConcurrentTasks()).isEqualTo(4);
            assertThat(slowStar.getMaxConcurrentTasks()).isEqualTo(3);
            assertThat(floor.getMaxConcurrentTasks()).isEqualTo(1);
            assertThat(ceiling.getMaxConcurrentTasks()).isEqualTo(10);
            assertThat(report.adjustments())
                    .extracting(CapacityAdjustment::agentName)
                    .contains("unreliable", "star")
                    .doesNotContain("slow_star", "floor", "ceiling");
        }

        @Test
        @DisplayName("should summarize strategy outcomes from the ledger")
        void summarizesStrategies() {
            orchestrator.investigate("case-13", Map.of()).block();

            AllocationReport report = orchestrator.optimizeAgentAllocation();

            assertThat(report.strategyPerformance().get(StrategyType.PARALLEL).total()).isEqualTo(3);
            assertThat(report.strategyPerformance().get(StrategyType.PARALLEL).successRate()).isEqualTo(1.0);
            assertThat(report.strategyPerformance().get(StrategyType.COMMITTEE).completed()).isEqualTo(1);
            assertThat(report.strategyPerformance()).doesNotContainKey(StrategyType.LOAD_BALANCED);
        }
    }
}
