package incident.commander.orchestration.state;

import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state carried through one graph run.
 *
 * <p>Merge rules for {@link #apply(StateUpdate)}:
 *
 * <ul>
 *   <li>stage slots, status and free-form values overwrite
 *   <li>{@code context} is shallow-merged
 *   <li>{@code timeline} is appended, never replaced or reordered
 * </ul>
 *
 * <p>Owned by the run that created it. Nodes read it; only the graph writes it.
 */
public class GraphState {

  private Incident incident;
  private final Map<String, Object> context = new LinkedHashMap<>();
  private final List<TimelineEvent> timeline = new ArrayList<>();
  private final Map<String, Object> values = new LinkedHashMap<>();
  private final List<String> completedNodes = new ArrayList<>();

  private StageResult detection;
  private StageResult diagnosis;
  private StageResult prediction;
  private ConsensusDecision consensus;
  private StageResult resolution;
  private StageResult communication;

  private String failedNode;
  private String failureReason;

  public GraphState(Incident incident, Map<String, Object> initialContext) {
    this.incident = Objects.requireNonNull(incident, "incident");
    if (initialContext != null) {
      context.putAll(initialContext);
    }
  }

  public void apply(StateUpdate update) {
    if (update == null) {
      return;
    }
    if (update.detection() != null) {
      detection = update.detection();
    }
    if (update.diagnosis() != null) {
      diagnosis = update.diagnosis();
    }
    if (update.prediction() != null) {
      prediction = update.prediction();
    }
    if (update.consensus() != null) {
      consensus = update.consensus();
    }
    if (update.resolution() != null) {
      resolution = update.resolution();
    }
    if (update.communication() != null) {
      communication = update.communication();
    }
    if (update.status() == IncidentStatus.RESOLVED && update.resolvedAt() != null) {
      incident = incident.resolve(update.resolvedAt());
    } else if (update.status() != null) {
      incident = incident.withStatus(update.status());
    }
    context.putAll(update.contextDelta());
    timeline.addAll(update.timelineEvents());
    values.putAll(update.values());
  }

  public void markCompleted(String node) {
    completedNodes.add(node);
  }

  public void markFailed(String node, String reason, TimelineEvent errorEvent) {
    this.failedNode = node;
    this.failureReason = reason;
    this.incident = incident.withStatus(IncidentStatus.FAILED);
    timeline.add(errorEvent);
  }

  public void recordNodeError(String node, String reason) {
    values.put(StateKeys.nodeError(node), reason);
  }

  public Incident incident() {
    return incident;
  }

  public Map<String, Object> context() {
    return Collections.unmodifiableMap(context);
  }

  public List<TimelineEvent> timeline() {
    return Collections.unmodifiableList(timeline);
  }

  public Map<String, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  public List<String> completedNodes() {
    return Collections.unmodifiableList(completedNodes);
  }

  public Optional<StageResult> detection() {
    return Optional.ofNullable(detection);
  }

  public Optional<StageResult> diagnosis() {
    return Optional.ofNullable(diagnosis);
  }

  public Optional<StageResult> prediction() {
    return Optional.ofNullable(prediction);
  }

  public Optional<ConsensusDecision> consensus() {
    return Optional.ofNullable(consensus);
  }

  public Optional<StageResult> resolution() {
    return Optional.ofNullable(resolution);
  }

  public Optional<StageResult> communication() {
    return Optional.ofNullable(communication);
  }

  public boolean isFailed() {
    return failedNode != null;
  }

  public String failedNode() {
    return failedNode;
  }

  public String failureReason() {
    return failureReason;
  }

  /** Phases in the order their events were appended. */
  public List<String> phases() {
    return timeline.stream().map(TimelineEvent::phase).toList();
  }
}
