package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import java.util.Locale;
import java.util.Map;

public class PredictionStage extends AgentStage {

  public static final String PHASE = "prediction";
  public static final String EXPECTED_MINUTES = "expected_minutes";
  public static final String PROJECTED_COST = "projected_cost";

  public PredictionStage(IncidentAgent agent, StageSupport support) {
    super(agent, support);
  }

  @Override
  public String phase() {
    return PHASE;
  }

  @Override
  protected void store(StateUpdate.Builder update, StageResult result) {
    update.prediction(result);
  }

  @Override
  protected String describe(
      GraphState state,
      StageResult result,
      StateUpdate.Builder update,
      Map<String, Object> timelineMetadata) {
    if (result.isEmpty()) {
      return "Prediction produced no recommendation";
    }
    Recommendation recommendation = result.primaryRecommendation().orElseThrow();
    Object minutes = recommendation.parameters().get(EXPECTED_MINUTES);
    Object cost = recommendation.parameters().get(PROJECTED_COST);
    if (minutes != null) {
      update.context(StateKeys.PREDICTED_MINUTES, minutes);
      timelineMetadata.put(EXPECTED_MINUTES, minutes);
    }
    if (cost != null) {
      update.context(StateKeys.PREDICTED_COST, cost);
      timelineMetadata.put(PROJECTED_COST, cost);
    }
    return String.format(
        Locale.ROOT,
        "Predicted %s minutes to recover with %s risk",
        minutes == null ? "unknown" : minutes,
        recommendation.riskLevel().name().toLowerCase(Locale.ROOT));
  }
}
