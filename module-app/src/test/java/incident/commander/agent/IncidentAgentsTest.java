package incident.commander.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.error.exception.UnknownAgentException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IncidentAgents Tests")
class IncidentAgentsTest {

  @Test
  @DisplayName("looks agents up by type")
  void lookup() {
    // Given
    HeuristicDetectionAgent detection = new HeuristicDetectionAgent();
    IncidentAgents agents = new IncidentAgents(List.of(detection, new HeuristicDiagnosisAgent()));

    // Then
    assertThat(agents.get(AgentType.DETECTION)).isSameAs(detection);
    assertThat(agents.all()).containsOnlyKeys(AgentType.DETECTION, AgentType.DIAGNOSIS);
  }

  @Test
  @DisplayName("missing type is an UnknownAgentException")
  void unknown() {
    IncidentAgents agents = new IncidentAgents(List.of(new HeuristicDetectionAgent()));

    assertThatThrownBy(() -> agents.get(AgentType.RESOLUTION))
        .isInstanceOf(UnknownAgentException.class);
  }

  @Test
  @DisplayName("two agents for one type are rejected")
  void duplicates() {
    assertThatThrownBy(
            () ->
                new IncidentAgents(
                    List.of(new HeuristicDetectionAgent(), new HeuristicDetectionAgent())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("detection");
  }
}
