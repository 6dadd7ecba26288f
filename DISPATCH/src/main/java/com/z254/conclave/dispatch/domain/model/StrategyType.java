package com.z254.conclave.dispatch.domain.model;

/**
 * Coordination algorithms available to the coordination service.
 */
public enum StrategyType {
    PARALLEL,
    SEQUENTIAL,
    COMMITTEE,
    LOAD_BALANCED
}
