package incident.commander.agent;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.state.StateKeys;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Severity-driven detection.
 *
 * <p>Confidence starts from a per-severity base and gains a small bonus for each telemetry source
 * (up to 0.04) and for alert volume on a log scale (up to 0.05), capped at 0.99.
 */
@Component
public class HeuristicDetectionAgent implements IncidentAgent {

  static final double MAX_CONFIDENCE = 0.99;

  @Override
  public AgentType type() {
    return AgentType.DETECTION;
  }

  @Override
  public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
    int telemetrySources = countOf(context.get(StateKeys.TELEMETRY_SOURCES));
    int alertCount = Math.max(1, AgentContexts.intValue(context.get(StateKeys.ALERT_COUNT), 1));

    double confidence =
        baseConfidence(incident)
            + Math.min(0.04, 0.01 * telemetrySources)
            + Math.min(0.05, 0.02 * Math.log10(alertCount));
    confidence = Math.min(MAX_CONFIDENCE, confidence);

    ActionType action =
        incident.severity().isHighOrCritical() ? ActionType.ESCALATE_INCIDENT : ActionType.NOTIFY_TEAM;

    return List.of(
        Recommendation.builder(type(), incident.id())
            .actionId("detect-" + incident.id())
            .actionType(action)
            .confidence(confidence)
            .riskLevel(RiskLevel.fromSeverity(incident.severity()))
            .reasoning(
                String.format(
                    Locale.ROOT,
                    "Detected %s incident '%s' from %d telemetry source(s) and %d alert(s)",
                    incident.severity().value(),
                    incident.title(),
                    telemetrySources,
                    alertCount))
            .estimatedImpact("Rapid triage for " + incident.title())
            .urgency(Math.round(confidence * 100) / 100.0)
            .parameters(Map.of("telemetry_sources", telemetrySources, "alert_count", alertCount))
            .build());
  }

  private static double baseConfidence(Incident incident) {
    return AgentContexts.bySeverity(incident.severity(), 0.95, 0.9, 0.82, 0.72);
  }

  private static int countOf(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.size();
    }
    return AgentContexts.intValue(value, 0);
  }
}
