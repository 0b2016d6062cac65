package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import java.util.Locale;
import java.util.Map;

public class DiagnosisStage extends AgentStage {

  public static final String PHASE = "diagnosis";

  public DiagnosisStage(IncidentAgent agent, StageSupport support) {
    super(agent, support);
  }

  @Override
  public String phase() {
    return PHASE;
  }

  @Override
  protected void store(StateUpdate.Builder update, StageResult result) {
    update.diagnosis(result);
  }

  @Override
  protected String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata) {
    if (result.isEmpty()) {
      return "Diagnosis produced no recommendation";
    }
    Recommendation recommendation = result.primaryRecommendation().orElseThrow();
    update
        .context(StateKeys.DIAGNOSIS_CONFIDENCE, recommendation.confidence())
        .context(StateKeys.DIAGNOSIS_ACTION, recommendation.actionType().value());
    timelineMetadata.put("action_type", recommendation.actionType().value());
    timelineMetadata.put("confidence", round(recommendation.confidence(), 3));
    return String.format(
        Locale.ROOT,
        "Diagnosis suggests %s (confidence %.2f)",
        recommendation.actionType().value(),
        recommendation.confidence());
  }
}
