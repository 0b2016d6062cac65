package incident.commander.orchestration.stage;

import incident.commander.core.consensus.ConsensusEngine;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.orchestration.GraphNode;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import incident.commander.orchestration.state.TimelineEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Votes over detection, diagnosis and prediction recommendations. */
@Slf4j
public class ConsensusStage implements GraphNode {

  public static final String PHASE = "consensus";

  private final ConsensusEngine engine;
  private final Clock clock;

  public ConsensusStage(ConsensusEngine engine, Clock clock) {
    this.engine = engine;
    this.clock = clock;
  }

  @Override
  public StateUpdate execute(GraphState state) {
    List<Recommendation> recommendations = new ArrayList<>();
    collect(recommendations, state.detection());
    collect(recommendations, state.diagnosis());
    collect(recommendations, state.prediction());

    ConsensusDecision decision = engine.reachConsensus(state.incident(), recommendations);
    log.info(
        "[Consensus] decision reached: incidentId={}, action={}, confidence={}, escalation={}, conflicts={}",
        state.incident().id(),
        decision.selectedAction(),
        decision.finalConfidence(),
        decision.requiresEscalation(),
        decision.conflictsDetected());

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("incident_id", state.incident().id());
    metadata.put("method", decision.consensusMethod());
    metadata.put("votes", recommendations.size());
    metadata.put("requires_escalation", decision.requiresEscalation());
    metadata.put("conflicts_detected", decision.conflictsDetected());

    StateUpdate.Builder update =
        StateUpdate.builder()
            .consensus(decision)
            .context(StateKeys.CONSENSUS_CONFIDENCE, decision.finalConfidence())
            .context(StateKeys.completedAt(PHASE), clock.instant().toString());
    decision
        .selectedActionId()
        .ifPresent(action -> update.context(StateKeys.CONSENSUS_ACTION, action));
    return update
        .timeline(TimelineEvent.of(PHASE, PHASE, message(decision), metadata, clock.instant()))
        .build();
  }

  private static void collect(List<Recommendation> into, Optional<StageResult> stage) {
    stage.ifPresent(result -> into.addAll(result.recommendations()));
  }

  private static String message(ConsensusDecision decision) {
    if (decision.isFallback()) {
      return "No recommendations to vote on; falling back to " + decision.actionType().value();
    }
    return String.format(
        Locale.ROOT,
        "Selected %s (%s) with score %.2f",
        decision.selectedAction(),
        decision.actionType().value(),
        decision.finalConfidence());
  }
}
