package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.infrastructure.messaging.AgentMessage;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.infrastructure.messaging.MessagePriority;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Runs the detection agent and announces the incident to the communication agent. */
public class DetectionStage extends AgentStage {

  public static final String PHASE = "detection";
  public static final String DETECTED_MESSAGE_TYPE = "incident.detected";
  static final Duration DETECTED_TTL = Duration.ofSeconds(300);

  private final MessageBus messageBus;

  public DetectionStage(IncidentAgent agent, StageSupport support, MessageBus messageBus) {
    super(agent, support);
    this.messageBus = messageBus;
  }

  @Override
  public String phase() {
    return PHASE;
  }

  @Override
  protected void store(StateUpdate.Builder update, StageResult result) {
    update.detection(result).status(IncidentStatus.DETECTED);
  }

  @Override
  protected String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata) {
    Optional<Recommendation> primary = result.primaryRecommendation();
    if (primary.isEmpty()) {
      return "Detection produced no recommendation";
    }
    Recommendation recommendation = primary.get();
    update
        .context(StateKeys.DETECTION_CONFIDENCE, recommendation.confidence())
        .context(StateKeys.DETECTION_ACTION_ID, recommendation.actionId());
    timelineMetadata.put("action_id", recommendation.actionId());
    timelineMetadata.put("confidence", round(recommendation.confidence(), 3));
    timelineMetadata.put("risk_level", recommendation.riskLevel().name().toLowerCase(Locale.ROOT));
    return String.format(
        Locale.ROOT,
        "Detected %s incident with confidence %.2f",
        state.incident().severity().value(),
        recommendation.confidence());
  }

  @Override
  protected void afterResult(GraphState state, StageResult result) {
    String incidentId = state.incident().id();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("incident_id", incidentId);
    payload.put("title", state.incident().title());
    payload.put("severity", state.incident().severity().value());
    result.primaryRecommendation().ifPresent(r -> payload.put("confidence", r.confidence()));

    AgentMessage message =
        new AgentMessage(
            AgentType.DETECTION.value(),
            AgentType.COMMUNICATION.value(),
            DETECTED_MESSAGE_TYPE,
            payload,
            incidentId);
    support
        .executor()
        .executeOrDefault(
            () -> messageBus.send(message, MessagePriority.HIGH, DETECTED_TTL),
            null,
            TaskContext.of("Stage", "announceDetection", incidentId));
  }
}
