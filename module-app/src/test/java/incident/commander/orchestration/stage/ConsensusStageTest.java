package incident.commander.orchestration.stage;

import static incident.commander.orchestration.support.OrchestrationFixtures.CLOCK;
import static incident.commander.orchestration.support.OrchestrationFixtures.recommendation;
import static org.assertj.core.api.Assertions.assertThat;

import incident.commander.core.consensus.WeightedConsensusEngine;
import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.support.OrchestrationFixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConsensusStage Tests")
class ConsensusStageTest {

  private ConsensusStage stage;
  private Incident incident;

  @BeforeEach
  void setUp() {
    stage = new ConsensusStage(new WeightedConsensusEngine(), CLOCK);
    incident = OrchestrationFixtures.incident("Checkout latency spike", IncidentSeverity.LOW);
  }

  @Test
  @DisplayName("votes over detection, diagnosis and prediction recommendations")
  void votesOverStages() {
    // Given
    GraphState state = new GraphState(incident, Map.of());
    state.apply(
        StateUpdate.builder()
            .detection(result(AgentType.DETECTION, "scale", ActionType.SCALE_UP, 0.9))
            .diagnosis(result(AgentType.DIAGNOSIS, "scale", ActionType.SCALE_UP, 0.8))
            .prediction(result(AgentType.PREDICTION, "restart", ActionType.RESTART_SERVICE, 0.6))
            .build());

    // When
    StateUpdate update = stage.execute(state);

    // Then
    ConsensusDecision decision = update.consensus();
    assertThat(decision.selectedAction()).isEqualTo("scale");
    assertThat(decision.participatingAgents())
        .containsExactly(AgentType.DETECTION, AgentType.DIAGNOSIS, AgentType.PREDICTION);
    assertThat(decision.conflictsDetected()).isTrue();
    assertThat(update.contextDelta())
        .containsEntry(StateKeys.CONSENSUS_ACTION, "scale")
        .containsEntry(StateKeys.CONSENSUS_CONFIDENCE, decision.finalConfidence());
    assertThat(update.timelineEvents()).singleElement().satisfies(event -> {
      assertThat(event.phase()).isEqualTo("consensus");
      assertThat(event.agent()).isEqualTo("consensus");
    });
  }

  @Test
  @DisplayName("no recommendations falls back without a selected action")
  void fallsBack() {
    // When
    StateUpdate update = stage.execute(new GraphState(incident, Map.of()));

    // Then
    assertThat(update.consensus().isFallback()).isTrue();
    assertThat(update.contextDelta())
        .doesNotContainKey(StateKeys.CONSENSUS_ACTION)
        .containsEntry(StateKeys.CONSENSUS_CONFIDENCE, 0.0);
  }

  private StageResult result(AgentType type, String actionId, ActionType action, double confidence) {
    return new StageResult(
        type,
        List.of(recommendation(type, incident, actionId, action, confidence)),
        Map.of(),
        Map.of());
  }
}
