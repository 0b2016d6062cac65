package incident.commander.core.domain.model.consensus;

import incident.commander.core.domain.model.agent.AgentType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-agent-type voting weight.
 *
 * <p>Weights are not required to sum to 1: the defaults sum to 1.1 and consensus scores are used
 * unnormalized.
 */
public final class AgentWeights {

  private static final double DEFAULT_WEIGHT = 0.1;

  private final Map<AgentType, Double> weights;

  private AgentWeights(Map<AgentType, Double> weights) {
    this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
  }

  public static AgentWeights defaults() {
    Map<AgentType, Double> map = new EnumMap<>(AgentType.class);
    map.put(AgentType.DETECTION, 0.2);
    map.put(AgentType.DIAGNOSIS, 0.4);
    map.put(AgentType.PREDICTION, 0.3);
    map.put(AgentType.RESOLUTION, 0.1);
    map.put(AgentType.COMMUNICATION, 0.1);
    return new AgentWeights(map);
  }

  public static AgentWeights of(Map<AgentType, Double> overrides) {
    Map<AgentType, Double> map = new EnumMap<>(defaults().weights);
    if (overrides != null) {
      overrides.forEach(
          (type, weight) -> {
            validate(type, weight);
            map.put(type, weight);
          });
    }
    return new AgentWeights(map);
  }

  public AgentWeights with(AgentType type, double weight) {
    validate(type, weight);
    Map<AgentType, Double> map = new EnumMap<>(weights);
    map.put(type, weight);
    return new AgentWeights(map);
  }

  public double weightOf(AgentType type) {
    return weights.getOrDefault(type, DEFAULT_WEIGHT);
  }

  public Map<AgentType, Double> asMap() {
    return weights;
  }

  private static void validate(AgentType type, Double weight) {
    if (type == null) {
      throw new IllegalArgumentException("agent type cannot be null");
    }
    if (weight == null || weight < 0.0 || weight.isNaN() || weight.isInfinite()) {
      throw new IllegalArgumentException("weight must be a finite non-negative number: " + weight);
    }
  }

  @Override
  public String toString() {
    return "AgentWeights" + weights;
  }
}
