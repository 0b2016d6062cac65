package incident.commander.core.consensus;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.consensus.AgentWeights;
import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.Incident;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Weighted voting over recommendations grouped by action id.
 *
 * <p>Score of an action = sum of {@code confidence * weight(agentType)} over its votes. The highest
 * score wins. On an exact tie the action backed by the heavier agent type wins, then the
 * lexicographically smallest action id. The winning score is reported as-is (it is not divided by
 * the total weight).
 *
 * <p>Stateless apart from configuration; safe for concurrent use.
 */
public class WeightedConsensusEngine implements ConsensusEngine {

  private static final Comparator<ActionTally> RANKING =
      Comparator.comparingDouble(ActionTally::score)
          .reversed()
          .thenComparing(Comparator.comparingDouble(ActionTally::topWeight).reversed())
          .thenComparing(ActionTally::actionId);

  private final AgentWeights weights;
  private final FragmentationPredicate fragmentation;
  private final Clock clock;

  public WeightedConsensusEngine() {
    this(AgentWeights.defaults(), FragmentationPredicate.winnerShareBelow(0.5), Clock.systemUTC());
  }

  public WeightedConsensusEngine(AgentWeights weights, FragmentationPredicate fragmentation) {
    this(weights, fragmentation, Clock.systemUTC());
  }

  public WeightedConsensusEngine(
      AgentWeights weights, FragmentationPredicate fragmentation, Clock clock) {
    this.weights = Objects.requireNonNull(weights, "weights");
    this.fragmentation = Objects.requireNonNull(fragmentation, "fragmentation");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ConsensusDecision reachConsensus(Incident incident, List<Recommendation> recommendations) {
    Objects.requireNonNull(incident, "incident");
    if (recommendations == null || recommendations.isEmpty()) {
      return ConsensusDecision.fallback(incident.id(), clock.instant());
    }

    List<ActionTally> tallies = tally(recommendations);
    ActionTally winner = tallies.stream().sorted(RANKING).findFirst().orElseThrow();

    Recommendation representative =
        winner.votes().stream()
            .max(Comparator.comparingDouble(r -> weights.weightOf(r.agentType())))
            .orElseThrow();

    boolean fragmented = fragmentation.isFragmented(winner, tallies);
    boolean escalate = incident.severity().isHighOrCritical() || fragmented;

    return new ConsensusDecision(
        incident.id(),
        winner.actionId(),
        representative.actionType(),
        winner.score(),
        ConsensusDecision.WEIGHTED_VOTING,
        escalate,
        participants(recommendations),
        scores(tallies),
        tallies.size() > 1,
        rationale(winner, tallies.size(), fragmented),
        clock.instant());
  }

  public AgentWeights weights() {
    return weights;
  }

  private List<ActionTally> tally(List<Recommendation> recommendations) {
    Map<String, List<Recommendation>> grouped = new LinkedHashMap<>();
    for (Recommendation r : recommendations) {
      grouped.computeIfAbsent(r.actionId(), k -> new ArrayList<>()).add(r);
    }

    List<ActionTally> tallies = new ArrayList<>(grouped.size());
    grouped.forEach(
        (actionId, votes) -> {
          double score = 0.0;
          double topWeight = 0.0;
          for (Recommendation vote : votes) {
            double weight = weights.weightOf(vote.agentType());
            score += vote.confidence() * weight;
            topWeight = Math.max(topWeight, weight);
          }
          tallies.add(new ActionTally(actionId, score, topWeight, votes));
        });
    return tallies;
  }

  private static List<AgentType> participants(List<Recommendation> recommendations) {
    LinkedHashSet<AgentType> seen = new LinkedHashSet<>();
    recommendations.forEach(r -> seen.add(r.agentType()));
    return List.copyOf(seen);
  }

  private static Map<String, Double> scores(List<ActionTally> tallies) {
    Map<String, Double> scores = new LinkedHashMap<>();
    tallies.forEach(t -> scores.put(t.actionId(), t.score()));
    return scores;
  }

  private static String rationale(ActionTally winner, int candidates, boolean fragmented) {
    String base =
        String.format(
            Locale.ROOT,
            "Selected %s with weighted score %.3f from %d vote(s) across %d candidate action(s)",
            winner.actionId(),
            winner.score(),
            winner.votes().size(),
            candidates);
    return fragmented ? base + "; support is fragmented" : base;
  }
}
