package incident.commander.core.consensus;

import incident.commander.core.domain.model.agent.Recommendation;
import java.util.List;

/**
 * Aggregated votes for one action id.
 *
 * @param actionId the action voted for
 * @param score sum of confidence x weight
 * @param topWeight highest agent weight among the voters
 * @param votes recommendations in input order
 */
public record ActionTally(
    String actionId, double score, double topWeight, List<Recommendation> votes) {

  public ActionTally {
    votes = List.copyOf(votes);
  }
}
