package incident.commander.core.consensus;

import java.util.List;

/**
 * Decides whether support is too fragmented to act without a human.
 *
 * <p>Receives the winner and every tally (winner included).
 */
@FunctionalInterface
public interface FragmentationPredicate {

  boolean isFragmented(ActionTally winner, List<ActionTally> tallies);

  /** Never reports fragmentation. */
  static FragmentationPredicate never() {
    return (winner, tallies) -> false;
  }

  /**
   * Fragmented when more than one action was voted for and the winner holds less than {@code
   * minimumShare} of the total score.
   */
  static FragmentationPredicate winnerShareBelow(double minimumShare) {
    if (minimumShare < 0.0 || minimumShare > 1.0) {
      throw new IllegalArgumentException("minimumShare must be within [0, 1]: " + minimumShare);
    }
    return (winner, tallies) -> {
      if (tallies.size() <= 1) {
        return false;
      }
      double total = tallies.stream().mapToDouble(ActionTally::score).sum();
      return total > 0.0 && winner.score() / total < minimumShare;
    };
  }
}
