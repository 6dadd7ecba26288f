package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.config.DispatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically retunes agent concurrency ceilings.
 */
@Component
@Slf4j
public class AgentCapacityController {

    private final InvestigationOrchestrator orchestrator;
    private final DispatchProperties.CapacityProperties config;

    public AgentCapacityController(InvestigationOrchestrator orchestrator, DispatchProperties dispatchProperties) {
        this.orchestrator = orchestrator;
        this.config = dispatchProperties.getCapacity();
    }

    @Scheduled(
            initialDelayString = "${dispatch.capacity.adjustment-interval:PT5M}",
            fixedDelayString = "${dispatch.capacity.adjustment-interval:PT5M}")
    public void adjustCapacity() {
        if (!config.isAdjustmentEnabled()) {
            return;
        }
        try {
            AllocationReport report = orchestrator.optimizeAgentAllocation();
            log.debug("Capacity pass complete: {} adjustments, strategy performance {}",
                    report.adjustments().size(), report.strategyPerformance());
        } catch (RuntimeException e) {
            log.error("Capacity adjustment pass failed: {}", e.getMessage(), e);
        }
    }
}
