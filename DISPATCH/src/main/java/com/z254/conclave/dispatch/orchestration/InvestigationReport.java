package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a three-phase investigation.
 */
@Value
@Builder
public class InvestigationReport {

    String caseId;

    /**
     * Phase 1 results, in configured order.
     */
    List<CoordinationResult> dataGathering;

    CoordinationResult riskAssessment;

    CoordinationResult finalDecision;

    CoordinationMetrics coordinationMetrics;

    Instant timestamp;

    public record CoordinationMetrics(
            int totalAgentsInvolved,
            int tasksCompleted,
            int ledgerSize,
            List<StrategyType> strategiesUsed) {
    }
}
