package incident.commander.orchestration.stage;

import static incident.commander.orchestration.support.OrchestrationFixtures.agent;
import static incident.commander.orchestration.support.OrchestrationFixtures.recommendation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.core.port.out.NotificationPort;
import incident.commander.core.port.out.NotificationRequest;
import incident.commander.infrastructure.messaging.AgentMessage;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.infrastructure.messaging.MessagePriority;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.support.OrchestrationFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("Resolution and Communication stage Tests")
class ResolutionAndCommunicationStageTest {

  private ExecutorService agentPool;
  private StageSupport support;
  private Incident incident;

  @BeforeEach
  void setUp() {
    agentPool = Executors.newCachedThreadPool();
    support = OrchestrationFixtures.support(agentPool);
    incident = OrchestrationFixtures.incident("Checkout latency spike", IncidentSeverity.MEDIUM);
  }

  @AfterEach
  void tearDown() {
    agentPool.shutdownNow();
  }

  private ConsensusDecision decision(boolean escalate) {
    return new ConsensusDecision(
        incident.id(),
        "diagnosis-1",
        ActionType.RESTART_SERVICE,
        0.32,
        ConsensusDecision.WEIGHTED_VOTING,
        escalate,
        List.of(AgentType.DIAGNOSIS),
        Map.of("diagnosis-1", 0.32),
        false,
        "diagnosis wins",
        Instant.parse("2024-03-01T10:00:00Z"));
  }

  @Nested
  @DisplayName("ResolutionStage")
  class Resolution {

    @Test
    @DisplayName("passes the consensus decision to the agent and marks the incident RESOLVING")
    void receivesDecision() throws Exception {
      // Given
      AtomicReference<Object> seen = new AtomicReference<>();
      IncidentAgent resolver =
          agent(
              AgentType.RESOLUTION,
              (inc, ctx) -> {
                seen.set(ctx.get(StateKeys.CONSENSUS_DECISION));
                return List.of(
                    recommendation(AgentType.RESOLUTION, inc, "r-1", ActionType.RESTART_SERVICE, 0.3));
              });
      GraphState state = new GraphState(incident, Map.of());
      ConsensusDecision decision = decision(false);
      state.apply(StateUpdate.builder().consensus(decision).build());

      // When
      StateUpdate update = new ResolutionStage(resolver, support).execute(state);

      // Then
      assertThat(seen.get()).isEqualTo(decision);
      assertThat(update.status()).isEqualTo(IncidentStatus.RESOLVING);
      assertThat(update.contextDelta())
          .containsEntry(StateKeys.RESOLUTION_ACTION, "restart_service")
          .containsEntry(StateKeys.RESOLUTION_READY, true);
      assertThat(state.context()).doesNotContainKey(StateKeys.CONSENSUS_DECISION);
    }
  }

  @Nested
  @DisplayName("CommunicationStage")
  class Communication {

    private NotificationPort notifications;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
      notifications = mock(NotificationPort.class);
      bus = mock(MessageBus.class);
    }

    private IncidentAgent communicator() {
      return agent(
          AgentType.COMMUNICATION,
          (inc, ctx) ->
              List.of(
                  Recommendation.builder(AgentType.COMMUNICATION, inc.id())
                      .actionId("communication-" + inc.id())
                      .actionType(ActionType.NOTIFY_TEAM)
                      .confidence(0.92)
                      .parameters(
                          Map.of(
                              CommunicationStage.SUMMARY, "All hands",
                              CommunicationStage.AUDIENCES, List.of("sre_on_call", "product_owner"),
                              CommunicationStage.CHANNELS, List.of("slack")))
                      .build()));
    }

    private GraphState readyState(boolean escalate) {
      GraphState state = new GraphState(incident, Map.of());
      state.apply(
          StateUpdate.builder()
              .consensus(decision(escalate))
              .context(StateKeys.RESOLUTION_READY, true)
              .build());
      return state;
    }

    @Test
    @DisplayName("resolves the incident when resolution is ready and no escalation is needed")
    void resolves() throws Exception {
      // When
      StateUpdate update =
          new CommunicationStage(communicator(), support, notifications, bus, true)
              .execute(readyState(false));

      // Then
      assertThat(update.status()).isEqualTo(IncidentStatus.RESOLVED);
      assertThat(update.resolvedAt()).isEqualTo(OrchestrationFixtures.CLOCK.instant());
      assertThat(update.contextDelta())
          .containsEntry(StateKeys.COMMUNICATION_SUMMARY, "All hands")
          .containsEntry(StateKeys.COMMUNICATION_CHANNELS, List.of("slack"));
      assertThat(update.timelineEvents().get(0).metadata())
          .containsEntry("recipients", List.of("sre_on_call", "product_owner"));
    }

    @Test
    @DisplayName("escalates when consensus asks for a human")
    void escalates() throws Exception {
      // When
      StateUpdate update =
          new CommunicationStage(communicator(), support, notifications, bus, true)
              .execute(readyState(true));

      // Then
      assertThat(update.status()).isEqualTo(IncidentStatus.ESCALATED);
      assertThat(update.resolvedAt()).isNull();
    }

    @Test
    @DisplayName("hands the summary to the notification port and publishes it on the bus")
    void dispatchesAndPublishes() throws Exception {
      // When
      new CommunicationStage(communicator(), support, notifications, bus, true)
          .execute(readyState(false));

      // Then
      ArgumentCaptor<NotificationRequest> request =
          ArgumentCaptor.forClass(NotificationRequest.class);
      verify(notifications).dispatch(request.capture());
      assertThat(request.getValue().summary()).isEqualTo("All hands");
      assertThat(request.getValue().channels()).containsExactly("slack");

      ArgumentCaptor<AgentMessage> message = ArgumentCaptor.forClass(AgentMessage.class);
      verify(bus).send(message.capture(), eq(MessagePriority.MEDIUM), any());
      assertThat(message.getValue().messageType())
          .isEqualTo(CommunicationStage.SUMMARY_MESSAGE_TYPE);
    }

    @Test
    @DisplayName("notification failures do not fail the stage and publishing can be disabled")
    void notificationIsBestEffort() throws Exception {
      // Given
      willThrow(new IllegalStateException("smtp down")).given(notifications).dispatch(any());

      // When
      StateUpdate update =
          new CommunicationStage(communicator(), support, notifications, bus, false)
              .execute(readyState(false));

      // Then
      assertThat(update.communication()).isNotNull();
      verify(bus, never()).send(any(), any(), any());
    }
  }
}
