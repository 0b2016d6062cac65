package incident.commander.agent;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.incident.BusinessImpact;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.stage.PredictionStage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Projects time to recovery and cost from severity and business impact. */
@Component
public class HeuristicPredictionAgent implements IncidentAgent {

  @Override
  public AgentType type() {
    return AgentType.PREDICTION;
  }

  @Override
  public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
    IncidentSeverity severity = incident.severity();
    int minutes = expectedMinutes(severity);
    RiskLevel risk = RiskLevel.fromSeverity(severity);
    BigDecimal costPerMinute =
        incident.impact().map(BusinessImpact::costPerMinute).orElse(BigDecimal.ZERO);
    double projectedCost =
        costPerMinute
            .multiply(BigDecimal.valueOf(minutes))
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();

    ActionType action = risk.isHighOrCritical() ? ActionType.INCREASE_CAPACITY : ActionType.NO_ACTION;

    return List.of(
        Recommendation.builder(type(), incident.id())
            .actionId("prediction-" + incident.id())
            .actionType(action)
            .confidence(AgentContexts.bySeverity(severity, 0.9, 0.85, 0.78, 0.7))
            .riskLevel(risk)
            .reasoning(
                String.format(
                    Locale.ROOT,
                    "%s incidents typically recover in about %d minutes",
                    severity.value(),
                    minutes))
            .estimatedImpact(
                String.format(
                    Locale.ROOT, "Projected cost $%,.2f over %d minutes", projectedCost, minutes))
            .urgency(risk.isHighOrCritical() ? 0.7 : 0.4)
            .parameters(
                Map.of(
                    PredictionStage.EXPECTED_MINUTES, minutes,
                    PredictionStage.PROJECTED_COST, projectedCost))
            .build());
  }

  static int expectedMinutes(IncidentSeverity severity) {
    return switch (severity) {
      case CRITICAL -> 45;
      case HIGH -> 30;
      case MEDIUM -> 18;
      case LOW -> 8;
    };
  }
}
