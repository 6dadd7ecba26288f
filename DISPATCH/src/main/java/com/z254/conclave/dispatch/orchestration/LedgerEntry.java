package com.z254.conclave.dispatch.orchestration;

import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;

/**
 * A coordinated task together with its outcome.
 */
public record LedgerEntry(String caseId, CoordinationTask task, StrategyType strategy, CoordinationResult result) {
}
