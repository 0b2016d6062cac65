package incident.commander.orchestration;

import incident.commander.core.domain.model.incident.Incident;
import incident.commander.orchestration.stage.AnalysisStage;
import incident.commander.orchestration.stage.CommunicationStage;
import incident.commander.orchestration.stage.ConsensusStage;
import incident.commander.orchestration.stage.DetectionStage;
import incident.commander.orchestration.stage.ResolutionStage;
import incident.commander.orchestration.state.GraphState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * The standard incident-response pipeline.
 *
 * <pre>
 * START → detection → analysis (diagnosis ∥ prediction) → consensus → resolution → communication → END
 * </pre>
 *
 * Communication is best-effort; every other node is required.
 */
@Slf4j
public class IncidentResponseGraph {

  public static final String NAME = "incident_response";
  public static final String DETECTION = "detection";
  public static final String ANALYSIS = "analysis";
  public static final String CONSENSUS = "consensus";
  public static final String RESOLUTION = "resolution";
  public static final String COMMUNICATION = "communication";

  static final String DURATION_METRIC = "incident.pipeline.duration";

  private final StateGraph graph;
  private final MeterRegistry meterRegistry;

  public IncidentResponseGraph(
      StateGraph graph,
      DetectionStage detection,
      AnalysisStage analysis,
      ConsensusStage consensus,
      ResolutionStage resolution,
      CommunicationStage communication,
      MeterRegistry meterRegistry) {
    this.graph =
        graph
            .addNode(DETECTION, detection)
            .addNode(ANALYSIS, analysis)
            .addNode(CONSENSUS, consensus)
            .addNode(RESOLUTION, resolution)
            .addNode(COMMUNICATION, communication, NodeOptions.bestEffort())
            .addEdge(StateGraph.START, DETECTION)
            .addEdge(DETECTION, ANALYSIS)
            .addEdge(ANALYSIS, CONSENSUS)
            .addEdge(CONSENSUS, RESOLUTION)
            .addEdge(RESOLUTION, COMMUNICATION)
            .addEdge(COMMUNICATION, StateGraph.END);
    this.meterRegistry = meterRegistry;
  }

  public GraphState respond(Incident incident, Map<String, Object> initialContext) {
    Timer.Sample sample = Timer.start(meterRegistry);
    return finish(graph.run(incident, initialContext), sample);
  }

  public CompletableFuture<GraphState> respondAsync(
      Incident incident, Map<String, Object> initialContext) {
    Timer.Sample sample = Timer.start(meterRegistry);
    return graph.runAsync(incident, initialContext).thenApply(state -> finish(state, sample));
  }

  public StateGraph graph() {
    return graph;
  }

  private GraphState finish(GraphState state, Timer.Sample sample) {
    sample.stop(meterRegistry.timer(DURATION_METRIC, "outcome", outcomeOf(state)));
    log.info(
        "[IncidentResponse] pipeline finished: incidentId={}, status={}, phases={}",
        state.incident().id(),
        state.incident().status(),
        state.phases());
    return state;
  }

  private static String outcomeOf(GraphState state) {
    return state.isFailed() ? "failed" : state.incident().status().name().toLowerCase(Locale.ROOT);
  }
}
