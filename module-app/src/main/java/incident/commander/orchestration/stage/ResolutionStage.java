package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Prepares the remediation step for the consensus action. */
public class ResolutionStage extends AgentStage {

  public static final String PHASE = "resolution";
  public static final String REQUIRES_HUMAN_APPROVAL = "requires_human_approval";

  public ResolutionStage(IncidentAgent agent, StageSupport support) {
    super(agent, support);
  }

  @Override
  public String phase() {
    return PHASE;
  }

  @Override
  protected Map<String, Object> agentContext(GraphState state) {
    Map<String, Object> context = new LinkedHashMap<>(state.context());
    state.consensus().ifPresent(decision -> context.put(StateKeys.CONSENSUS_DECISION, decision));
    return context;
  }

  @Override
  protected void store(StateUpdate.Builder update, StageResult result) {
    update.resolution(result).status(IncidentStatus.RESOLVING);
  }

  @Override
  protected String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata) {
    update.context(StateKeys.RESOLUTION_READY, !result.isEmpty());
    if (result.isEmpty()) {
      return "Resolution produced no remediation step";
    }
    Recommendation recommendation = result.primaryRecommendation().orElseThrow();
    Object requiresHuman = recommendation.parameters().getOrDefault(REQUIRES_HUMAN_APPROVAL, true);
    update.context(StateKeys.RESOLUTION_ACTION, recommendation.actionType().value());
    timelineMetadata.put("action_type", recommendation.actionType().value());
    timelineMetadata.put(REQUIRES_HUMAN_APPROVAL, requiresHuman);
    return String.format(
        Locale.ROOT,
        "Prepared %s with confidence %.2f",
        recommendation.actionType().value(),
        recommendation.confidence());
  }
}
