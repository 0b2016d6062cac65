package incident.commander.core.port.out;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.incident.Incident;
import java.util.List;
import java.util.Map;

/**
 * An incident-response agent.
 *
 * <p>Agents are external collaborators: the orchestration layer only relies on this contract. An
 * agent may return an empty list; a thrown exception is treated as a stage failure.
 */
public interface IncidentAgent {

  AgentType type();

  /**
   * Produces recommendations for the incident.
   *
   * @param incident incident under response
   * @param context read-only snapshot of the shared pipeline context
   * @return recommendations, possibly empty, never {@code null}
   */
  List<Recommendation> processIncident(Incident incident, Map<String, Object> context);
}
