package com.z254.conclave.dispatch.coordination;

import com.z254.conclave.dispatch.config.DispatchConfig;
import com.z254.conclave.dispatch.config.DispatchProperties;
import com.z254.conclave.dispatch.domain.model.AgentCapabilities;
import com.z254.conclave.dispatch.domain.model.AgentOutcome;
import com.z254.conclave.dispatch.domain.model.CoordinationResult;
import com.z254.conclave.dispatch.domain.model.CoordinationStatus;
import com.z254.conclave.dispatch.domain.model.CoordinationTask;
import com.z254.conclave.dispatch.domain.model.StrategyType;
import com.z254.conclave.dispatch.domain.model.Vote;
import com.z254.conclave.dispatch.domain.model.VoteDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Decides by weighted vote of a sampled committee of matching agents.
 *
 * <p>Each voter is dispatched like any other agent call. A voter's output is read as a ballot:
 * either a decision string, or a map with {@code decision}, optional {@code confidence} and
 * {@code reasoning}. Without an explicit confidence the vote weighs the agent's success rate.
 * Failed calls count as zero-weight abstentions.
 */
@Component
@Slf4j
public class CommitteeStrategy implements CoordinationStrategy {

    public static final String VOTE_OPTIONS_KEY = "vote_options";
    public static final String DECISION_KEY = "decision";
    public static final String CONFIDENCE_KEY = "confidence";
    public static final String REASONING_KEY = "reasoning";

    private final AgentDispatcher dispatcher;
    private final Random random;
    private final int quorum;
    private final int maxVoters;

    public CommitteeStrategy(
            AgentDispatcher dispatcher,
            DispatchProperties dispatchProperties,
            @Qualifier(DispatchConfig.COORDINATION_RANDOM) Random random) {
        this.dispatcher = dispatcher;
        this.random = random;
        this.quorum = dispatchProperties.getCoordination().getCommitteeQuorum();
        this.maxVoters = dispatchProperties.getCoordination().getCommitteeMaxVoters();
    }

    @Override
    public StrategyType getType() {
        return StrategyType.COMMITTEE;
    }

    @Override
    public Mono<CoordinationResult> coordinate(List<AgentCapabilities> agents, CoordinationTask task) {
        List<AgentCapabilities> matches = AgentRanking.matching(agents, task);
        if (matches.isEmpty()) {
            return Mono.just(CoordinationResult.status(CoordinationStatus.NO_AGENTS_AVAILABLE, getName(),
                    task.getTaskId(), "No agent has capabilities " + task.getRequiredCapabilities()));
        }
        if (matches.size() < quorum) {
            return Mono.just(CoordinationResult.status(CoordinationStatus.INSUFFICIENT_AGENTS, getName(),
                    task.getTaskId(),
                    "Committee needs at least " + quorum + " matching agents, found " + matches.size()));
        }

        List<AgentCapabilities> voters = sample(matches);
        Map<String, Double> defaultWeights = new LinkedHashMap<>();
        voters.forEach(agent -> defaultWeights.put(agent.getName(), agent.getSuccessRate()));
        Map<String, Object> ballot = ballot(task);

        log.debug("Committee of {} voting on task {}", defaultWeights.keySet(), task.getTaskId());

        return Flux.fromIterable(voters)
                .flatMapSequential(agent -> dispatcher.dispatch(agent, task, ballot, getName(), 0))
                .collectList()
                .map(outcomes -> tally(task, voters, outcomes, defaultWeights));
    }

    private List<AgentCapabilities> sample(List<AgentCapabilities> matches) {
        List<AgentCapabilities> shuffled = new ArrayList<>(matches);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(maxVoters, shuffled.size())));
    }

    private static Map<String, Object> ballot(CoordinationTask task) {
        Map<String, Object> ballot = new LinkedHashMap<>(task.getInputData());
        ballot.put(VOTE_OPTIONS_KEY, Arrays.stream(VoteDecision.values()).map(VoteDecision::getValue).toList());
        return ballot;
    }

    private CoordinationResult tally(CoordinationTask task, List<AgentCapabilities> voters,
                                     List<AgentOutcome> outcomes, Map<String, Double> defaultWeights) {
        List<Vote> votes = new ArrayList<>();
        List<AgentOutcome> weighted = new ArrayList<>();
        Map<VoteDecision, Double> totals = new EnumMap<>(VoteDecision.class);
        for (VoteDecision decision : VoteDecision.values()) {
            totals.put(decision, 0.0);
        }

        for (AgentOutcome outcome : outcomes) {
            Vote vote = toVote(outcome, defaultWeights.getOrDefault(outcome.getAgentName(), 0.0));
            votes.add(vote);
            weighted.add(outcome.toBuilder().confidence(vote.getConfidence()).build());
            totals.merge(vote.getDecision(), vote.getConfidence(), Double::sum);
        }

        double total = totals.values().stream().mapToDouble(Double::doubleValue).sum();
        VoteDecision decision = VoteDecision.ABSTAIN;
        double best = 0.0;
        // Declaration order breaks ties: approve, reject, abstain
        for (Map.Entry<VoteDecision, Double> entry : totals.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                decision = entry.getKey();
            }
        }
        boolean anyVoted = outcomes.stream().anyMatch(AgentOutcome::isSuccess);

        Map<String, Object> tallies = new LinkedHashMap<>();
        totals.forEach((key, value) -> tallies.put(key.getValue(), value));

        return CoordinationResult.builder()
                .status(anyVoted ? CoordinationStatus.COMPLETED : CoordinationStatus.FAILED)
                .strategyName(getName())
                .taskId(task.getTaskId())
                .selectedAgents(voters.stream().map(AgentCapabilities::getName).toList())
                .outcomes(weighted)
                .votes(votes)
                .decision(decision)
                .confidence(total > 0 ? best / total : 0.0)
                .finalOutput(decision.getValue())
                .attribute("vote_totals", tallies)
                .message(anyVoted
                        ? "Committee decided " + decision.getValue() + " with " + votes.size() + " votes"
                        : "No committee member produced a vote")
                .build();
    }

    static Vote toVote(AgentOutcome outcome, double defaultWeight) {
        if (!outcome.isSuccess()) {
            return Vote.builder()
                    .agentName(outcome.getAgentName())
                    .decision(VoteDecision.ABSTAIN)
                    .confidence(0.0)
                    .reasoning("Vote failed: " + outcome.getError())
                    .build();
        }

        Object output = outcome.getOutput();
        if (output instanceof Map<?, ?> map) {
            return Vote.builder()
                    .agentName(outcome.getAgentName())
                    .decision(VoteDecision.parse(map.get(DECISION_KEY)))
                    .confidence(weight(map.get(CONFIDENCE_KEY), defaultWeight))
                    .reasoning(map.get(REASONING_KEY) != null ? String.valueOf(map.get(REASONING_KEY)) : null)
                    .build();
        }
        return Vote.builder()
                .agentName(outcome.getAgentName())
                .decision(VoteDecision.parse(output))
                .confidence(defaultWeight)
                .build();
    }

    private static double weight(Object raw, double defaultWeight) {
        if (raw instanceof Number number) {
            return Math.min(1.0, Math.max(0.0, number.doubleValue()));
        }
        return defaultWeight;
    }
}
