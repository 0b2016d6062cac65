package incident.commander.agent;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.stage.ResolutionStage;
import incident.commander.orchestration.state.StateKeys;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns the consensus decision into a remediation step.
 *
 * <p>Without a decision in the context the step is a no-op that waits for an operator.
 */
@Component
public class HeuristicResolutionAgent implements IncidentAgent {

  @Override
  public AgentType type() {
    return AgentType.RESOLUTION;
  }

  @Override
  public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
    Object value = context.get(StateKeys.CONSENSUS_DECISION);
    ConsensusDecision decision = value instanceof ConsensusDecision d ? d : null;

    ActionType action = decision == null ? ActionType.NO_ACTION : decision.actionType();
    double confidence = decision == null ? 0.5 : Math.min(1.0, decision.finalConfidence());
    boolean requiresHuman = decision == null || decision.requiresEscalation();
    String reasoning =
        decision == null
            ? "Consensus unavailable; awaiting operator guidance"
            : "Executing consensus action: " + decision.rationale();

    Map<String, Object> parameters = new LinkedHashMap<>();
    if (decision != null && decision.selectedAction() != null) {
      parameters.put(StateKeys.CONSENSUS_ACTION, decision.selectedAction());
    }
    parameters.put(ResolutionStage.REQUIRES_HUMAN_APPROVAL, requiresHuman);

    return List.of(
        Recommendation.builder(type(), incident.id())
            .actionId("resolution-" + incident.id())
            .actionType(action)
            .confidence(confidence)
            .riskLevel(requiresHuman ? RiskLevel.HIGH : RiskLevel.MEDIUM)
            .reasoning(reasoning)
            .estimatedImpact("Remediation step " + action.value() + " prepared")
            .urgency(requiresHuman ? 0.5 : 0.8)
            .parameters(parameters)
            .build());
  }
}
