package com.z254.conclave.dispatch.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A weighted committee vote.
 */
@Value
@Builder
public class Vote {

    String agentName;

    VoteDecision decision;

    /**
     * Weight of the vote in the tally.
     */
    double confidence;

    String reasoning;
}
