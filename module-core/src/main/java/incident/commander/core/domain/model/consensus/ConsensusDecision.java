package incident.commander.core.domain.model.consensus;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of weighted consensus over a set of recommendations.
 *
 * @param incidentId incident the decision is for
 * @param selectedAction winning action id, {@code null} only for the fallback decision
 * @param actionType category of the winning action
 * @param finalConfidence raw weighted score of the winning action (not normalized, may exceed 1)
 * @param consensusMethod {@link #WEIGHTED_VOTING} or {@link #WEIGHTED_FALLBACK}
 * @param requiresEscalation whether a human must approve the action
 * @param participatingAgents distinct agent types that voted, in input order
 * @param actionScores weighted score per action id
 * @param conflictsDetected whether more than one action received votes
 * @param rationale human-readable explanation
 * @param decidedAt decision time
 */
public record ConsensusDecision(
    String incidentId,
    String selectedAction,
    ActionType actionType,
    double finalConfidence,
    String consensusMethod,
    boolean requiresEscalation,
    List<AgentType> participatingAgents,
    Map<String, Double> actionScores,
    boolean conflictsDetected,
    String rationale,
    Instant decidedAt) {

  public static final String WEIGHTED_VOTING = "weighted_voting";
  public static final String WEIGHTED_FALLBACK = "weighted_fallback";

  public ConsensusDecision {
    Objects.requireNonNull(incidentId, "incidentId");
    Objects.requireNonNull(actionType, "actionType");
    Objects.requireNonNull(consensusMethod, "consensusMethod");
    if (finalConfidence < 0.0 || Double.isNaN(finalConfidence)) {
      throw new IllegalArgumentException("finalConfidence must be >= 0: " + finalConfidence);
    }
    participatingAgents = participatingAgents == null ? List.of() : List.copyOf(participatingAgents);
    actionScores = actionScores == null ? Map.of() : Map.copyOf(actionScores);
    rationale = rationale == null ? "" : rationale;
    Objects.requireNonNull(decidedAt, "decidedAt");
  }

  /** Decision produced when no agent made a recommendation. */
  public static ConsensusDecision fallback(String incidentId, Instant decidedAt) {
    return new ConsensusDecision(
        incidentId,
        null,
        ActionType.NO_ACTION,
        0.0,
        WEIGHTED_FALLBACK,
        false,
        List.of(),
        Map.of(),
        false,
        "No agent recommendations available",
        decidedAt);
  }

  public boolean isFallback() {
    return WEIGHTED_FALLBACK.equals(consensusMethod);
  }

  public Optional<String> selectedActionId() {
    return Optional.ofNullable(selectedAction);
  }
}
