package incident.commander.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.orchestration.state.GraphState;
import incident.commander.orchestration.state.StageResult;
import incident.commander.orchestration.state.TimelineEvent;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Final state of one pipeline run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentRunResponse(
    String incidentId,
    String title,
    String severity,
    String status,
    Instant detectedAt,
    Instant resolvedAt,
    List<String> completedNodes,
    List<String> phases,
    StageResult detection,
    StageResult diagnosis,
    StageResult prediction,
    ConsensusDecision consensus,
    StageResult resolution,
    StageResult communication,
    Map<String, Object> context,
    Map<String, Object> values,
    List<TimelineEvent> timeline,
    String failedNode,
    String failureReason) {

  public static IncidentRunResponse from(GraphState state) {
    Incident incident = state.incident();
    return new IncidentRunResponse(
        incident.id(),
        incident.title(),
        incident.severity().value(),
        incident.status().name().toLowerCase(Locale.ROOT),
        incident.detectedAt(),
        incident.resolvedAt(),
        state.completedNodes(),
        state.phases(),
        state.detection().orElse(null),
        state.diagnosis().orElse(null),
        state.prediction().orElse(null),
        state.consensus().orElse(null),
        state.resolution().orElse(null),
        state.communication().orElse(null),
        state.context(),
        state.values(),
        state.timeline(),
        state.failedNode(),
        state.failureReason());
  }
}
