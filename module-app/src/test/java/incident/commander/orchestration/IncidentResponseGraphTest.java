package incident.commander.orchestration;

import static incident.commander.orchestration.support.OrchestrationFixtures.CLOCK;
import static incident.commander.orchestration.support.OrchestrationFixtures.agent;
import static incident.commander.orchestration.support.OrchestrationFixtures.failingAgent;
import static incident.commander.orchestration.support.OrchestrationFixtures.recommendation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import incident.commander.agent.HeuristicCommunicationAgent;
import incident.commander.agent.HeuristicDetectionAgent;
import incident.commander.agent.HeuristicDiagnosisAgent;
import incident.commander.agent.HeuristicPredictionAgent;
import incident.commander.agent.HeuristicResolutionAgent;
import incident.commander.core.consensus.WeightedConsensusEngine;
import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.core.port.out.NotificationPort;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.orchestration.stage.AnalysisStage;
import incident.commander.orchestration.stage.CommunicationStage;
import incident.commander.orchestration.stage.ConsensusStage;
import incident.commander.orchestration.stage.DetectionStage;
import incident.commander.orchestration.stage.DiagnosisStage;
import incident.commander.orchestration.stage.PredictionStage;
import incident.commander.orchestration.stage.ResolutionStage;
import incident.commander.orchestration.stage.StageSupport;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.TimelineEvent;
import incident.commander.orchestration.support.OrchestrationFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IncidentResponseGraph Tests")
class IncidentResponseGraphTest {

  private static final List<String> ALL_PHASES =
      List.of("detection", "diagnosis", "prediction", "consensus", "resolution", "communication");

  private ExecutorService graphPool;
  private ExecutorService stagePool;
  private ExecutorService agentPool;
  private StageSupport support;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    graphPool = Executors.newFixedThreadPool(2);
    stagePool = Executors.newFixedThreadPool(2);
    agentPool = Executors.newCachedThreadPool();
    support = OrchestrationFixtures.support(agentPool);
    meterRegistry = new SimpleMeterRegistry();
  }

  @AfterEach
  void tearDown() {
    graphPool.shutdownNow();
    stagePool.shutdownNow();
    agentPool.shutdownNow();
  }

  private IncidentResponseGraph graph(
      IncidentAgent detection,
      IncidentAgent diagnosis,
      IncidentAgent prediction,
      IncidentAgent resolution,
      IncidentAgent communication) {
    MessageBus bus = mock(MessageBus.class);
    return new IncidentResponseGraph(
        new StateGraph(IncidentResponseGraph.NAME, support.executor(), graphPool, CLOCK),
        new DetectionStage(detection, support, bus),
        new AnalysisStage(
            new DiagnosisStage(diagnosis, support),
            new PredictionStage(prediction, support),
            support.executor(),
            stagePool,
            CLOCK),
        new ConsensusStage(new WeightedConsensusEngine(), CLOCK),
        new ResolutionStage(resolution, support),
        new CommunicationStage(communication, support, mock(NotificationPort.class), bus, true),
        meterRegistry);
  }

  private IncidentResponseGraph heuristicGraph() {
    return graph(
        new HeuristicDetectionAgent(),
        new HeuristicDiagnosisAgent(),
        new HeuristicPredictionAgent(),
        new HeuristicResolutionAgent(),
        new HeuristicCommunicationAgent());
  }

  private static Incident checkoutLatency() {
    return Incident.create(
        "Checkout latency spike",
        "p99 latency on checkout above 2s since 10:00",
        IncidentSeverity.HIGH);
  }

  @Nested
  @DisplayName("Heuristic pipeline")
  class HeuristicPipeline {

    @Test
    @DisplayName("runs every phase in order and escalates a HIGH incident")
    void fullRun() {
      // Given
      Map<String, Object> context =
          Map.of(
              StateKeys.TELEMETRY_SOURCES, List.of("prometheus", "tracing"),
              StateKeys.ALERT_COUNT, 12);

      // When
      GraphState state = heuristicGraph().respond(checkoutLatency(), context);

      // Then
      assertThat(state.isFailed()).isFalse();
      assertThat(state.phases()).containsExactlyElementsOf(ALL_PHASES);
      assertThat(state.completedNodes())
          .containsExactly("detection", "analysis", "consensus", "resolution", "communication");
      assertThat(state.incident().status()).isEqualTo(IncidentStatus.ESCALATED);

      ConsensusDecision decision = state.consensus().orElseThrow();
      assertThat(decision.finalConfidence()).isGreaterThan(0.0);
      assertThat(decision.requiresEscalation()).isTrue();
      assertThat(state.resolution().orElseThrow().primaryRecommendation().orElseThrow().parameters())
          .containsEntry(StateKeys.CONSENSUS_ACTION, decision.selectedAction());

      TimelineEvent communication = state.timeline().get(state.timeline().size() - 1);
      assertThat(communication.metadata().get("recipients")).asList().isNotEmpty();
    }

    @Test
    @DisplayName("records the pipeline duration tagged with the outcome")
    void timerRecorded() {
      // When
      heuristicGraph().respond(checkoutLatency(), Map.of());

      // Then
      assertThat(
              meterRegistry
                  .get(IncidentResponseGraph.DURATION_METRIC)
                  .tag("outcome", "escalated")
                  .timer()
                  .count())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("respondAsync completes with the same shape of state")
    void async() throws Exception {
      // When
      GraphState state =
          heuristicGraph().respondAsync(checkoutLatency(), Map.of()).get(5, TimeUnit.SECONDS);

      // Then
      assertThat(state.phases()).containsExactlyElementsOf(ALL_PHASES);
    }
  }

  @Nested
  @DisplayName("Outcomes")
  class Outcomes {

    private IncidentAgent voting(AgentType type) {
      return agent(
          type,
          (incident, ctx) ->
              List.of(recommendation(type, incident, "restart-api", ActionType.RESTART_SERVICE, 0.9)));
    }

    @Test
    @DisplayName("unanimous votes on a LOW incident resolve it")
    void resolves() {
      // Given
      Incident incident =
          OrchestrationFixtures.incident("Stale cache on search", IncidentSeverity.LOW);

      // When
      GraphState state =
          graph(
                  voting(AgentType.DETECTION),
                  voting(AgentType.DIAGNOSIS),
                  voting(AgentType.PREDICTION),
                  new HeuristicResolutionAgent(),
                  new HeuristicCommunicationAgent())
              .respond(incident, Map.of());

      // Then
      assertThat(state.consensus().orElseThrow().selectedAction()).isEqualTo("restart-api");
      assertThat(state.incident().status()).isEqualTo(IncidentStatus.RESOLVED);
      assertThat(state.incident().resolvedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("detection failure stops the run as FAILED")
    void detectionFails() {
      // When
      GraphState state =
          graph(
                  failingAgent(AgentType.DETECTION, "detector offline"),
                  new HeuristicDiagnosisAgent(),
                  new HeuristicPredictionAgent(),
                  new HeuristicResolutionAgent(),
                  new HeuristicCommunicationAgent())
              .respond(checkoutLatency(), Map.of());

      // Then
      assertThat(state.isFailed()).isTrue();
      assertThat(state.failedNode()).isEqualTo(IncidentResponseGraph.DETECTION);
      assertThat(state.failureReason()).contains("detector offline");
      assertThat(state.incident().status()).isEqualTo(IncidentStatus.FAILED);
      assertThat(state.phases()).containsExactly(TimelineEvent.ERROR_PHASE);
      assertThat(meterRegistry.get(IncidentResponseGraph.DURATION_METRIC).tag("outcome", "failed").timer().count())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("communication failure is recorded and the run still completes")
    void communicationFails() {
      // When
      GraphState state =
          graph(
                  new HeuristicDetectionAgent(),
                  new HeuristicDiagnosisAgent(),
                  new HeuristicPredictionAgent(),
                  new HeuristicResolutionAgent(),
                  failingAgent(AgentType.COMMUNICATION, "slack down"))
              .respond(checkoutLatency(), Map.of());

      // Then
      assertThat(state.isFailed()).isFalse();
      assertThat(state.incident().status()).isEqualTo(IncidentStatus.RESOLVING);
      assertThat(state.values())
          .hasEntrySatisfying(
              StateKeys.nodeError(IncidentResponseGraph.COMMUNICATION),
              reason -> assertThat(reason.toString()).contains("slack down"));
      assertThat(state.communication()).isEmpty();
    }
  }
}
