package incident.commander.core.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertAll;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.AgentWeights;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WeightedConsensusEngine")
class WeightedConsensusEngineTest {

  private final WeightedConsensusEngine engine = new WeightedConsensusEngine();

  private static Incident incident(IncidentSeverity severity) {
    return Incident.create("Checkout latency spike", "p99 above SLO", severity);
  }

  private static Recommendation vote(
      Incident incident, AgentType agent, String actionId, ActionType type, double confidence) {
    return Recommendation.builder(agent, incident.id())
        .actionId(actionId)
        .actionType(type)
        .confidence(confidence)
        .build();
  }

  @Nested
  @DisplayName("empty input")
  class EmptyInput {

    @Test
    @DisplayName("returns the fallback decision instead of throwing")
    void fallback() {
      Incident incident = incident(IncidentSeverity.CRITICAL);

      ConsensusDecision decision = engine.reachConsensus(incident, List.of());

      assertAll(
          () -> assertThat(decision.consensusMethod()).isEqualTo("weighted_fallback"),
          () -> assertThat(decision.finalConfidence()).isZero(),
          () -> assertThat(decision.selectedAction()).isNull(),
          () -> assertThat(decision.actionType()).isEqualTo(ActionType.NO_ACTION),
          () -> assertThat(decision.requiresEscalation()).isFalse(),
          () -> assertThat(decision.incidentId()).isEqualTo(incident.id()));
    }

    @Test
    @DisplayName("stamps the fallback decision with the engine's clock")
    void fallbackUsesClock() {
      Instant now = Instant.parse("2024-03-01T10:00:00Z");
      WeightedConsensusEngine fixed =
          new WeightedConsensusEngine(
              AgentWeights.defaults(),
              FragmentationPredicate.winnerShareBelow(0.5),
              Clock.fixed(now, ZoneOffset.UTC));

      ConsensusDecision decision = fixed.reachConsensus(incident(IncidentSeverity.LOW), List.of());

      assertThat(decision.decidedAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("treats a null list like an empty one")
    void nullList() {
      ConsensusDecision decision = engine.reachConsensus(incident(IncidentSeverity.LOW), null);

      assertThat(decision.isFallback()).isTrue();
    }
  }

  @Nested
  @DisplayName("weighted voting")
  class Voting {

    @Test
    @DisplayName("sums confidence x weight per action id and reports the raw score")
    void sumsWeightedConfidence() {
      // Given
      Incident incident = incident(IncidentSeverity.MEDIUM);
      List<Recommendation> votes =
          List.of(
              vote(incident, AgentType.DETECTION, "restart", ActionType.RESTART_SERVICE, 0.9),
              vote(incident, AgentType.DIAGNOSIS, "restart", ActionType.RESTART_SERVICE, 0.8),
              vote(incident, AgentType.PREDICTION, "scale", ActionType.SCALE_UP, 0.9));

      // When
      ConsensusDecision decision = engine.reachConsensus(incident, votes);

      // Then: restart = 0.9*0.2 + 0.8*0.4 = 0.50, scale = 0.9*0.3 = 0.27
      assertThat(decision.selectedAction()).isEqualTo("restart");
      assertThat(decision.actionType()).isEqualTo(ActionType.RESTART_SERVICE);
      assertThat(decision.finalConfidence()).isCloseTo(0.50, within(1e-9));
      assertThat(decision.actionScores()).containsKeys("restart", "scale");
      assertThat(decision.conflictsDetected()).isTrue();
      assertThat(decision.consensusMethod()).isEqualTo("weighted_voting");
    }

    @Test
    @DisplayName("does not normalize: agreement of every agent can exceed 1.0")
    void unnormalizedScore() {
      Incident incident = incident(IncidentSeverity.LOW);
      List<Recommendation> votes =
          List.of(AgentType.values()).stream()
              .map(a -> vote(incident, a, "notify", ActionType.NOTIFY_TEAM, 1.0))
              .toList();

      ConsensusDecision decision = engine.reachConsensus(incident, votes);

      assertThat(decision.finalConfidence()).isCloseTo(1.1, within(1e-9));
      assertThat(decision.conflictsDetected()).isFalse();
    }

    @Test
    @DisplayName("lists each participating agent type once, in input order")
    void participants() {
      Incident incident = incident(IncidentSeverity.LOW);
      List<Recommendation> votes =
          List.of(
              vote(incident, AgentType.PREDICTION, "a", ActionType.SCALE_UP, 0.5),
              vote(incident, AgentType.DETECTION, "b", ActionType.NOTIFY_TEAM, 0.5),
              vote(incident, AgentType.PREDICTION, "b", ActionType.NOTIFY_TEAM, 0.5));

      ConsensusDecision decision = engine.reachConsensus(incident, votes);

      assertThat(decision.participatingAgents())
          .containsExactly(AgentType.PREDICTION, AgentType.DETECTION);
    }
  }

  @Nested
  @DisplayName("tie-breaking")
  class TieBreak {

    @Test
    @DisplayName("an exact tie goes to the action backed by the heavier agent type")
    void heavierAgentWins() {
      // Given
      Incident incident = incident(IncidentSeverity.LOW);
      AgentWeights weights = AgentWeights.defaults();
      WeightedConsensusEngine exact =
          new WeightedConsensusEngine(weights, FragmentationPredicate.never());
      List<Recommendation> votes =
          List.of(
              vote(incident, AgentType.DETECTION, "a-detect", ActionType.ESCALATE_INCIDENT, 0.5),
              vote(incident, AgentType.COMMUNICATION, "z-comm", ActionType.NOTIFY_TEAM, 1.0));

      // When: detection 0.2*0.5 and communication 0.1*1.0 both score 0.1
      ConsensusDecision decision = exact.reachConsensus(incident, votes);

      // Then
      assertThat(decision.selectedAction()).isEqualTo("a-detect");
    }

    @Test
    @DisplayName("same score and same weight falls back to the smallest action id")
    void lexicographicFallback() {
      Incident incident = incident(IncidentSeverity.LOW);
      List<Recommendation> votes =
          List.of(
              vote(incident, AgentType.DIAGNOSIS, "rollback", ActionType.ROLLBACK_DEPLOYMENT, 0.5),
              vote(incident, AgentType.DIAGNOSIS, "restart", ActionType.RESTART_SERVICE, 0.5));

      ConsensusDecision decision = engine.reachConsensus(incident, votes);

      assertThat(decision.selectedAction()).isEqualTo("restart");
    }
  }

  @Nested
  @DisplayName("escalation")
  class Escalation {

    @Test
    @DisplayName("high and critical severities always require escalation")
    void severityEscalates() {
      Incident high = incident(IncidentSeverity.HIGH);

      ConsensusDecision decision =
          engine.reachConsensus(
              high, List.of(vote(high, AgentType.DIAGNOSIS, "x", ActionType.SCALE_UP, 0.9)));

      assertThat(decision.requiresEscalation()).isTrue();
    }

    @Test
    @DisplayName("a unanimous low-severity decision does not escalate")
    void unanimousLowDoesNotEscalate() {
      Incident low = incident(IncidentSeverity.LOW);

      ConsensusDecision decision =
          engine.reachConsensus(
              low, List.of(vote(low, AgentType.DIAGNOSIS, "x", ActionType.SCALE_UP, 0.9)));

      assertThat(decision.requiresEscalation()).isFalse();
    }

    @Test
    @DisplayName("fragmented support escalates through the injected predicate")
    void fragmentationEscalates() {
      // Given: three actions with similar scores, winner share < 0.5
      Incident low = incident(IncidentSeverity.LOW);
      List<Recommendation> votes =
          List.of(
              vote(low, AgentType.DIAGNOSIS, "a", ActionType.SCALE_UP, 0.5),
              vote(low, AgentType.PREDICTION, "b", ActionType.RESTART_SERVICE, 0.6),
              vote(low, AgentType.DETECTION, "c", ActionType.NOTIFY_TEAM, 0.8));

      // When
      ConsensusDecision defaults = engine.reachConsensus(low, votes);
      ConsensusDecision never =
          new WeightedConsensusEngine(AgentWeights.defaults(), FragmentationPredicate.never())
              .reachConsensus(low, votes);

      // Then
      assertThat(defaults.requiresEscalation()).isTrue();
      assertThat(defaults.rationale()).contains("fragmented");
      assertThat(never.requiresEscalation()).isFalse();
    }
  }
}
