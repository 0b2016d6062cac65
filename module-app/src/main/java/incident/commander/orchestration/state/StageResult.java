package incident.commander.orchestration.state;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one agent stage.
 *
 * @param agent agent that ran
 * @param recommendations what it recommended, possibly empty
 * @param metrics numbers worth charting (latency, confidence, ...)
 * @param metadata anything else the stage wants to keep
 */
public record StageResult(
    AgentType agent,
    List<Recommendation> recommendations,
    Map<String, Object> metrics,
    Map<String, Object> metadata) {

  public StageResult {
    Objects.requireNonNull(agent, "agent");
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    metrics = copy(metrics);
    metadata = copy(metadata);
  }

  public Optional<Recommendation> primaryRecommendation() {
    return recommendations.stream().findFirst();
  }

  public boolean isEmpty() {
    return recommendations.isEmpty();
  }

  private static Map<String, Object> copy(Map<String, Object> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
