package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.core.port.out.NotificationPort;
import incident.commander.core.port.out.NotificationRequest;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the stakeholder summary, hands it to the notification layer and settles the final
 * incident status.
 *
 * <p>The incident is RESOLVED when a remediation step is ready and consensus did not ask for
 * escalation; otherwise it is ESCALATED.
 */
public class CommunicationStage extends AgentStage {

  public static final String PHASE = "communication";
  public static final String SUMMARY_MESSAGE_TYPE = "incident.summary";
  public static final String AUDIENCES = "audiences";
  public static final String CHANNELS = "channels";
  public static final String SUMMARY = "summary";
  static final Duration SUMMARY_TTL = Duration.ofSeconds(600);

  private final NotificationPort notifications;
  private final MessageBus messageBus;
  private final boolean publishSummary;

  public CommunicationStage(
      IncidentAgent agent,
      StageSupport support,
      NotificationPort notifications,
      MessageBus messageBus,
      boolean publishSummary) {
    super(agent, support);
    this.notifications = notifications;
    this.messageBus = messageBus;
    this.publishSummary = publishSummary;
  }

  @Override
  public String phase() {
    return PHASE;
  }

  @Override
  protected Map<String, Object> agentContext(GraphState state) {
    Map<String, Object> context = new LinkedHashMap<>(state.context());
    state.consensus().ifPresent(decision -> context.put(StateKeys.CONSENSUS_DECISION, decision));
    state
        .resolution()
        .flatMap(StageResult::primaryRecommendation)
        .ifPresent(r -> context.put(StateKeys.RESOLUTION_RECOMMENDATION, r));
    return context;
  }

  @Override
  protected void store(StateUpdate.Builder update, StageResult result) {
    update.communication(result);
  }

  @Override
  protected String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata) {
    settleStatus(state, update);

    Optional<Recommendation> primary = result.primaryRecommendation();
    List<String> audiences = stringList(primary, AUDIENCES);
    List<String> channels = stringList(primary, CHANNELS);
    String summary = primary.map(CommunicationStage::summaryOf).orElse("");

    update
        .context(StateKeys.COMMUNICATION_SUMMARY, summary)
        .context(StateKeys.COMMUNICATION_CHANNELS, channels);
    timelineMetadata.put("recipients", audiences);
    timelineMetadata.put("channels", channels);
    return primary.isEmpty() ? "No stakeholder summary produced" : summary;
  }

  @Override
  protected void afterResult(GraphState state, StageResult result) {
    Optional<Recommendation> primary = result.primaryRecommendation();
    if (primary.isEmpty()) {
      return;
    }
    String incidentId = state.incident().id();
    String summary = summaryOf(primary.get());
    List<String> audiences = stringList(primary, AUDIENCES);
    List<String> channels = stringList(primary, CHANNELS);

    support
        .executor()
        .executeOrDefault(
            () -> {
              notifications.dispatch(
                  new NotificationRequest(
                      incidentId,
                      summary,
                      audiences,
                      channels,
                      Map.of("severity", state.incident().severity().value())));
              return Boolean.TRUE;
            },
            Boolean.FALSE,
            TaskContext.of("Stage", "dispatchNotification", incidentId));

    if (!publishSummary) {
      return;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("incident_id", incidentId);
    payload.put(SUMMARY, summary);
    payload.put(AUDIENCES, audiences);
    payload.put(CHANNELS, channels);
    AgentMessage message =
        new AgentMessage(
            AgentType.COMMUNICATION.value(),
            AgentType.COMMUNICATION.value(),
            SUMMARY_MESSAGE_TYPE,
            payload,
            incidentId);
    support
        .executor()
        .executeOrDefault(
            () -> messageBus.send(message, MessagePriority.MEDIUM, SUMMARY_TTL),
            null,
            TaskContext.of("Stage", "publishSummary", incidentId));
  }

  private void settleStatus(GraphState state, StateUpdate.Builder update) {
    boolean resolutionReady =
        Boolean.TRUE.equals(state.context().get(StateKeys.RESOLUTION_READY));
    boolean escalate = state.consensus().map(ConsensusDecision::requiresEscalation).orElse(true);
    if (resolutionReady && !escalate) {
      update.status(IncidentStatus.RESOLVED).resolvedAt(support.clock().instant());
    } else {
      update.status(IncidentStatus.ESCALATED);
    }
  }

  private static String summaryOf(Recommendation recommendation) {
    Object summary = recommendation.parameters().get(SUMMARY);
    return summary == null ? recommendation.reasoning() : summary.toString();
  }

  private static List<String> stringList(Optional<Recommendation> recommendation, String key) {
    return recommendation
        .map(r -> r.parameters().get(key))
        .filter(List.class::isInstance)
        .map(value -> ((List<?>) value).stream().map(String::valueOf).toList())
        .orElse(List.of());
  }
}
