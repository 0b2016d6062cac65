package incident.commander.agent;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.state.StateKeys;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Keyword diagnosis over the incident description. The first matching keyword wins. */
@Component
public class HeuristicDiagnosisAgent implements IncidentAgent {

  private static final Map<String, Hypothesis> HYPOTHESES = new LinkedHashMap<>();

  static {
    HYPOTHESES.put(
        "latency",
        new Hypothesis(ActionType.INCREASE_CAPACITY, "Latency spike suggests scaling nodes"));
    HYPOTHESES.put(
        "timeout",
        new Hypothesis(ActionType.RESTART_SERVICE, "Timeouts suggest a hung service instance"));
    HYPOTHESES.put(
        "error",
        new Hypothesis(ActionType.ROLLBACK_DEPLOYMENT, "Error burst suggests a bad deployment"));
    HYPOTHESES.put("cpu", new Hypothesis(ActionType.SCALE_UP, "CPU saturation suggests scaling up"));
    HYPOTHESES.put(
        "memory", new Hypothesis(ActionType.SCALE_UP, "Memory pressure suggests scaling up"));
  }

  @Override
  public AgentType type() {
    return AgentType.DIAGNOSIS;
  }

  @Override
  public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
    Optional<Map.Entry<String, Hypothesis>> match = match(incident.description());
    ActionType action = match.map(e -> e.getValue().action()).orElse(ActionType.NO_ACTION);
    String reasoning =
        match.map(e -> e.getValue().reasoning()).orElse("No known failure signature in description");

    Map<String, Object> parameters = new LinkedHashMap<>();
    match.ifPresent(e -> parameters.put("matched_keyword", e.getKey()));
    Object logSources = context.get(StateKeys.LOG_SOURCES);
    if (logSources != null) {
      parameters.put(StateKeys.LOG_SOURCES, logSources);
    }

    return List.of(
        Recommendation.builder(type(), incident.id())
            .actionId("diagnosis-" + incident.id())
            .actionType(action)
            .confidence(AgentContexts.bySeverity(incident.severity(), 0.88, 0.82, 0.74, 0.65))
            .riskLevel(RiskLevel.MEDIUM)
            .reasoning(reasoning)
            .estimatedImpact("Root cause hypothesis for " + incident.title())
            .urgency(match.isPresent() ? 0.6 : 0.35)
            .parameters(parameters)
            .build());
  }

  private static Optional<Map.Entry<String, Hypothesis>> match(String description) {
    String text = AgentContexts.lower(description);
    return HYPOTHESES.entrySet().stream().filter(e -> text.contains(e.getKey())).findFirst();
  }

  private record Hypothesis(ActionType action, String reasoning) {}
}
