package incident.commander.orchestration.stage;

import incident.commander.core.domain.model.incident.IncidentStatus;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.orchestration.GraphNode;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StateKeys;
import incident.commander.orchestration.state.StateUpdate;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fan-out/fan-in node: diagnosis and prediction run concurrently on the same state snapshot and
 * their updates are merged, diagnosis first.
 *
 * <p>Both branches always run to completion. If either fails the node fails with that error.
 */
public class AnalysisStage implements GraphNode {

  public static final String PHASE = "analysis";

  private final DiagnosisStage diagnosis;
  private final PredictionStage prediction;
  private final LogicExecutor executor;
  private final Executor branchExecutor;
  private final Clock clock;

  public AnalysisStage(
      DiagnosisStage diagnosis,
      PredictionStage prediction,
      LogicExecutor executor,
      Executor branchExecutor,
      Clock clock) {
    this.diagnosis = diagnosis;
    this.prediction = prediction;
    this.executor = executor;
    this.branchExecutor = branchExecutor;
    this.clock = clock;
  }

  @Override
  public StateUpdate execute(GraphState state) {
    String incidentId = state.incident().id();
    CompletableFuture<StateUpdate> diagnosisRun = branch(diagnosis, state, incidentId);
    CompletableFuture<StateUpdate> predictionRun = branch(prediction, state, incidentId);

    CompletableFuture.allOf(diagnosisRun, predictionRun).join();

    StateUpdate analysis =
        StateUpdate.builder()
            .status(IncidentStatus.ANALYZING)
            .context(StateKeys.completedAt(PHASE), clock.instant().toString())
            .build();
    return StateUpdate.merge(
        StateUpdate.merge(diagnosisRun.join(), predictionRun.join()), analysis);
  }

  private CompletableFuture<StateUpdate> branch(
      AgentStage stage, GraphState state, String incidentId) {
    return CompletableFuture.supplyAsync(
        () ->
            executor.execute(
                () -> stage.execute(state), TaskContext.of("Analysis", stage.phase(), incidentId)),
        branchExecutor);
  }
}
