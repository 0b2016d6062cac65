package incident.commander.agent;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.error.exception.UnknownAgentException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Agent lookup by type. Every {@link IncidentAgent} bean registers here. */
@Component
public class IncidentAgents {

  private final Map<AgentType, IncidentAgent> agents = new EnumMap<>(AgentType.class);

  public IncidentAgents(List<IncidentAgent> candidates) {
    for (IncidentAgent agent : candidates) {
      IncidentAgent previous = agents.putIfAbsent(agent.type(), agent);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate agent for type " + agent.type().value() + ": "
                + previous.getClass().getSimpleName() + ", " + agent.getClass().getSimpleName());
      }
    }
  }

  public IncidentAgent get(AgentType type) {
    IncidentAgent agent = agents.get(type);
    if (agent == null) {
      throw new UnknownAgentException(type.value());
    }
    return agent;
  }

  public Map<AgentType, IncidentAgent> all() {
    return Collections.unmodifiableMap(agents);
  }
}
