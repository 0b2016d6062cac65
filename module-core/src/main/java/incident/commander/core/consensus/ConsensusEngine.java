package incident.commander.core.consensus;

import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import java.util.List;

/**
 * Turns agent recommendations into a single decision.
 *
 * <p>Implementations never return {@code null} and never throw for an empty recommendation list.
 */
public interface ConsensusEngine {

  ConsensusDecision reachConsensus(Incident incident, List<Recommendation> recommendations);
}
