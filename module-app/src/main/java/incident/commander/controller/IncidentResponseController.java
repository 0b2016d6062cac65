package incident.commander.controller;

import incident.commander.controller.dto.IncidentRunRequest;
import incident.commander.controller.dto.IncidentRunResponse;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.global.response.ApiResponse;
import incident.commander.orchestration.IncidentResponseGraph;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Incident response API.
 *
 * <ul>
 *   <li>POST /api/incidents/response - run the standard pipeline for one incident
 * </ul>
 *
 * <p>A run that stops on a failed stage still answers 200; the body carries {@code failedNode} and
 * {@code failureReason}.
 */
@Slf4j
@RestController
@RequestMapping("/api/incidents")
@RequiredArgsConstructor
public class IncidentResponseController {

  private final IncidentResponseGraph incidentResponseGraph;

  @PostMapping("/response")
  public CompletableFuture<ResponseEntity<ApiResponse<IncidentRunResponse>>> respond(
      @Valid @RequestBody IncidentRunRequest request) {
    Incident incident = request.toIncident();
    log.info(
        "[IncidentResponseController] run requested: incidentId={}, severity={}",
        incident.id(),
        incident.severity().value());
    return incidentResponseGraph
        .respondAsync(incident, request.initialContext())
        .thenApply(state -> ResponseEntity.ok(ApiResponse.success(IncidentRunResponse.from(state))));
  }
}
