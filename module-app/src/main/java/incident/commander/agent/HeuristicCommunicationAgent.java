package incident.commander.agent;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.stage.CommunicationStage;
import incident.commander.orchestration.state.StateKeys;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Renders the stakeholder summary for SRE, product and executive audiences. */
@Component
public class HeuristicCommunicationAgent implements IncidentAgent {

  static final List<String> AUDIENCES = List.of("sre_on_call", "product_owner", "executive_bridge");
  static final List<String> CHANNELS = List.of("slack", "email");

  @Override
  public AgentType type() {
    return AgentType.COMMUNICATION;
  }

  @Override
  public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
    String summary = summarize(incident, context);
    return List.of(
        Recommendation.builder(type(), incident.id())
            .actionId("communication-" + incident.id())
            .actionType(ActionType.NOTIFY_TEAM)
            .confidence(0.92)
            .riskLevel(RiskLevel.LOW)
            .reasoning("Stakeholders need a consolidated status update")
            .estimatedImpact("Keeps " + AUDIENCES.size() + " audiences informed")
            .urgency(0.85)
            .parameters(
                Map.of(
                    CommunicationStage.SUMMARY, summary,
                    CommunicationStage.AUDIENCES, AUDIENCES,
                    CommunicationStage.CHANNELS, CHANNELS))
            .build());
  }

  static String summarize(Incident incident, Map<String, Object> context) {
    Object decisionValue = context.get(StateKeys.CONSENSUS_DECISION);
    Object resolutionValue = context.get(StateKeys.RESOLUTION_RECOMMENDATION);

    String selected = "none";
    String actionType = ActionType.NO_ACTION.value();
    double confidence = 0.0;
    if (decisionValue instanceof ConsensusDecision decision) {
      selected = decision.selectedActionId().orElse("none");
      actionType = decision.actionType().value();
      confidence = decision.finalConfidence();
    }
    String resolutionAction =
        resolutionValue instanceof Recommendation resolution
            ? resolution.actionType().value()
            : "pending";

    return String.format(
        Locale.ROOT,
        "Incident %s: Action %s (%s) at confidence %.2f. Resolution step %s prepared. "
            + "Communications ready for SRE, product, and executive channels.",
        incident.id(),
        selected,
        actionType,
        confidence,
        resolutionAction);
  }
}
