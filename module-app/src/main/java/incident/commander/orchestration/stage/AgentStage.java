package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.GraphNode;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.state.TimelineEvent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapter that runs one {@link IncidentAgent} as a graph node.
 *
 * <p>Template:
 *
 * <ol>
 *   <li>build the agent's context from the state ({@link #agentContext})
 *   <li>call the agent through its circuit breaker with the stage timeout
 *   <li>wrap the recommendations (possibly none) in a {@link StageResult}
 *   <li>let the subclass store the result and add its context keys and timeline metadata
 *   <li>emit exactly one timeline event and {@code <phase>_completed_at}
 *   <li>run the subclass's side effects ({@link #afterResult})
 * </ol>
 */
@Slf4j
public abstract class AgentStage implements GraphNode {

  protected final IncidentAgent agent;
  protected final StageSupport support;

  protected AgentStage(IncidentAgent agent, StageSupport support) {
    this.agent = agent;
    this.support = support;
  }

  /** Phase name used for the timeline and the completion key. */
  public abstract String phase();

  /** Puts the result in its typed slot. */
  protected abstract void store(StateUpdate.Builder update, StageResult result);

  /**
   * Adds stage-specific context keys and timeline metadata.
   *
   * @return the timeline message
   */
  protected abstract String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata);

  protected Map<String, Object> agentContext(GraphState state) {
    return state.context();
  }

  /** Side effects after the update is built. Failures here must not fail the stage. */
  protected void afterResult(GraphState state, StageResult result) {}

  @Override
  public StateUpdate execute(GraphState state) throws Exception {
    Incident incident = state.incident();
    Map<String, Object> context = agentContext(state);

    long start = System.nanoTime();
    List<Recommendation> recommendations = invokeAgent(incident, context);
    double latencyMs = (System.nanoTime() - start) / 1_000_000.0;

    StageResult result =
        new StageResult(
            agent.type(),
            recommendations,
            metrics(recommendations, latencyMs),
            Map.of("recommendation_count", recommendations.size()));

    StateUpdate.Builder update = StateUpdate.builder();
    store(update, result);

    Map<String, Object> timelineMetadata = new LinkedHashMap<>();
    timelineMetadata.put("incident_id", incident.id());
    timelineMetadata.put("latency_ms", round(latencyMs, 2));
    String message = describe(state, result, update, timelineMetadata);

    update
        .context(StateKeys.completedAt(phase()), support.clock().instant().toString())
        .timeline(
            TimelineEvent.of(
                phase(), agent.type().value(), message, timelineMetadata, support.clock().instant()));

    log.info(
        "[Stage:{}] completed: incidentId={}, recommendations={}, latencyMs={}",
        phase(),
        incident.id(),
        recommendations.size(),
        round(latencyMs, 2));

    afterResult(state, result);
    return update.build();
  }

  private List<Recommendation> invokeAgent(Incident incident, Map<String, Object> context)
      throws Exception {
    List<Recommendation> recommendations =
        support
            .breakers()
            .agentBreaker(agent.type())
            .call(
                () -> agent.processIncident(incident, context),
                support.stageTimeout(),
                support.agentExecutor());
    return recommendations == null ? List.of() : recommendations;
  }

  private static Map<String, Object> metrics(List<Recommendation> recommendations, double latencyMs) {
    Map<String, Object> metrics = new LinkedHashMap<>();
    metrics.put("latency_ms", round(latencyMs, 2));
    metrics.put("recommendation_count", recommendations.size());
    if (!recommendations.isEmpty()) {
      metrics.put("confidence", round(recommendations.get(0).confidence(), 3));
      metrics.put("risk_level", recommendations.get(0).riskLevel().name().toLowerCase(Locale.ROOT));
    }
    return metrics;
  }

  static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }
}
