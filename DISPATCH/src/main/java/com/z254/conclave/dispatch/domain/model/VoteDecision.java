package com.z254.conclave.dispatch.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A committee member's ballot.
 */
public enum VoteDecision {
    APPROVE("approve"),
    REJECT("reject"),
    ABSTAIN("abstain");

    private final String value;

    VoteDecision(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a ballot. Unrecognized values count as an abstention.
     */
    public static VoteDecision parse(Object raw) {
        if (raw == null) {
            return ABSTAIN;
        }
        String normalized = raw.toString().trim().toLowerCase(Locale.ROOT);
        for (VoteDecision decision : values()) {
            if (decision.value.equals(normalized)) {
                return decision;
            }
        }
        return ABSTAIN;
    }
}
