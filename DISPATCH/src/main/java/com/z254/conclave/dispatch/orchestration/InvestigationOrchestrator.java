package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.accounting.SlidingWindow;
import com.z254.conclave.dispatch.agent.AgentCapabilityPool;
import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.coordination.CoordinationService;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentWorkload;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs investigations as three coordinated phases:
 * <ol>
 *   <li>Data gathering - one parallel task per data domain</li>
 *   <li>Risk assessment - a committee vote over the gathered results</li>
 *   <li>Decision synthesis - a sequential pipeline over everything so far</li>
 * </ol>
 * Every coordinated task is recorded in a ledger, which also drives capacity tuning.
 */
@Service
@Slf4j
public class InvestigationOrchestrator {

    public static final String CASE_ID_KEY = "case_id";
    public static final String GATHERING_RESULTS_KEY = "gathering_results";
    public static final String RISK_ASSESSMENT_KEY = "risk_assessment";

    private final CoordinationService coordinationService;
    private final AgentCapabilityPool pool;
    private final DispatchProperties.InvestigationProperties investigation;
    private final DispatchProperties.CapacityProperties capacity;
    private final SlidingWindow<LedgerEntry> ledger;

    public InvestigationOrchestrator(
            CoordinationService coordinationService,
            AgentCapabilityPool pool,
            DispatchProperties dispatchProperties) {
        this.coordinationService = coordinationService;
        this.pool = pool;
        this.investigation = dispatchProperties.getInvestigation();
        this.capacity = dispatchProperties.getCapacity();
        this.ledger = new SlidingWindow<>(investigation.getLedgerCapacity());
    }

    /**
     * Investigate a case.
     *
     * @param caseId case identifier
     * @param caseData case data; gathering tasks read their configured entries from it
     * @return the investigation report
     */
    public Mono<InvestigationReport> investigate(String caseId, Map<String, Object> caseData) {
        Map<String, Object> data = caseData != null ? caseData : Map.of();
        log.info("Starting coordinated investigation for case {}", caseId);

        return gather(caseId, data)
                .flatMap(gathering -> assess(caseId, gathering)
                        .flatMap(risk -> synthesize(caseId, gathering, risk)
                                .map(decision -> report(caseId, gathering, risk, decision))))
                .doOnNext(report -> log.info("Investigation of case {} finished: decision {}",
                        caseId, report.getFinalDecision().getStatus().getValue()));
    }

    private Mono<List<CoordinationResult>> gather(String caseId, Map<String, Object> caseData) {
        return Flux.fromIterable(investigation.getGathering())
                .flatMapSequential(phase -> {
                    Map<String, Object> input = new LinkedHashMap<>();
                    input.put(CASE_ID_KEY, caseId);
                    String inputKey = phase.getInputKey() != null ? phase.getInputKey() : phase.getName();
                    Object domainData = phase.getCaseDataKey() != null ? caseData.get(phase.getCaseDataKey()) : null;
                    input.put(inputKey, domainData != null ? domainData : Map.of());
                    return coordinate(caseId, task(caseId, phase, input, List.of()), StrategyType.PARALLEL);
                })
                .collectList();
    }

    private Mono<CoordinationResult> assess(String caseId, List<CoordinationResult> gathering) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put(CASE_ID_KEY, caseId);
        input.put(GATHERING_RESULTS_KEY, gathering);
        List<String> dependencies = gathering.stream().map(CoordinationResult::getTaskId).toList();
        return coordinate(caseId, task(caseId, investigation.getAssessment(), input, dependencies),
                StrategyType.COMMITTEE);
    }

    private Mono<CoordinationResult> synthesize(String caseId, List<CoordinationResult> gathering,
                                                CoordinationResult risk) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put(CASE_ID_KEY, caseId);
        input.put(GATHERING_RESULTS_KEY, gathering);
        input.put(RISK_ASSESSMENT_KEY, risk);
        return coordinate(caseId, task(caseId, investigation.getSynthesis(), input, List.of(risk.getTaskId())),
                StrategyType.SEQUENTIAL);
    }

    private Mono<CoordinationResult> coordinate(String caseId, CoordinationTask task, StrategyType strategy) {
        return coordinationService.execute(task, strategy)
                .doOnNext(result -> {
                    ledger.add(new LedgerEntry(caseId, task, strategy, result));
                    log.debug("Case {} task {} via {}: {}",
                            caseId, task.getTaskId(), strategy, result.getStatus().getValue());
                });
    }

    private static CoordinationTask task(String caseId, DispatchProperties.PhaseTask phase,
                                         Map<String, Object> input, List<String> dependencies) {
        return CoordinationTask.builder()
                .taskId(caseId + ":" + phase.getName())
                .taskType(phase.getTaskType())
                .complexity(phase.getComplexity())
                .requiredCapabilities(phase.getRequiredCapabilities())
                .inputData(input)
                .priority(phase.getPriority())
                .dependencies(dependencies)
                .build();
    }

    private InvestigationReport report(String caseId, List<CoordinationResult> gathering,
                                       CoordinationResult risk, CoordinationResult decision) {
        int tasks = gathering.size() + 2;
        int completed = (int) gathering.stream().filter(CoordinationResult::isCompleted).count()
                + (risk.isCompleted() ? 1 : 0)
                + (decision.isCompleted() ? 1 : 0);
        log.debug("Case {}: {} of {} tasks completed", caseId, completed, tasks);

        return InvestigationReport.builder()
                .caseId(caseId)
                .dataGathering(gathering)
                .riskAssessment(risk)
                .finalDecision(decision)
                .coordinationMetrics(new InvestigationReport.CoordinationMetrics(
                        pool.size(), completed, ledger.size(),
                        List.of(StrategyType.PARALLEL, StrategyType.COMMITTEE, StrategyType.SEQUENTIAL)))
                .timestamp(Instant.now())
                .build();
    }

    /**
     * All recorded (task, result) pairs, oldest first.
     */
    public List<LedgerEntry> getLedger() {
        return ledger.snapshot();
    }

    public List<AgentWorkload> getAgentWorkloadReport() {
        return pool.getWorkloadReport();
    }

    /**
     * Summarize strategy outcomes from the ledger and retune agent ceilings from observed performance:
     * unreliable agents lose a slot, fast and reliable agents gain one.
     */
    public AllocationReport optimizeAgentAllocation() {
        Map<StrategyType, int[]> tallies = new EnumMap<>(StrategyType.class);
        for (LedgerEntry entry : ledger.snapshot()) {
            int[] tally = tallies.computeIfAbsent(entry.strategy(), k -> new int[2]);
            tally[0]++;
            if (entry.result().isCompleted()) {
                tally[1]++;
            }
        }
        Map<StrategyType, StrategyPerformance> performance = new EnumMap<>(StrategyType.class);
        tallies.forEach((strategy, tally) ->
                performance.put(strategy, new StrategyPerformance(strategy, tally[0], tally[1])));

        List<CapacityAdjustment> adjustments = new ArrayList<>();
        for (AgentCapabilities agent : pool.getAll()) {
            int previous = agent.getMaxConcurrentTasks();
            double successRate = agent.getSuccessRate();

            if (successRate < capacity.getSuccessRateFloor() && previous > capacity.getMinCapacity()) {
                int applied = agent.adjustMaxConcurrentTasks(Math.max(capacity.getMinCapacity(), previous - 1));
                if (applied != previous) {
                    adjustments.add(new CapacityAdjustment(agent.getName(), previous, applied,
                            String.format("success rate %.3f below %.2f", successRate,
                                    capacity.getSuccessRateFloor())));
                }
            } else if (successRate > capacity.getSuccessRateCeiling()
                    && agent.getAvgResponseTime() < capacity.getFastResponseSeconds()
                    && previous < capacity.getMaxCapacity()) {
                int applied = agent.adjustMaxConcurrentTasks(Math.min(capacity.getMaxCapacity(), previous + 1));
                if (applied != previous) {
                    adjustments.add(new CapacityAdjustment(agent.getName(), previous, applied,
                            String.format("success rate %.3f above %.2f with %.2fs response", successRate,
                                    capacity.getSuccessRateCeiling(), agent.getAvgResponseTime())));
                }
            }
        }

        adjustments.forEach(a -> log.info("Adjusted capacity of {}: {} -> {} ({})",
                a.agentName(), a.previousCapacity(), a.newCapacity(), a.reason()));
        return new AllocationReport(performance, adjustments);
    }
}
