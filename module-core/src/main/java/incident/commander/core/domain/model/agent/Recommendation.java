package incident.commander.core.domain.model.agent;

import java.util.Map;
import java.util.Objects;

/**
 * One agent's proposed action for an incident. Write-once.
 *
 * @param agentType recommending agent
 * @param incidentId incident the recommendation is for
 * @param actionId action identifier; recommendations sharing it are votes for the same action
 * @param actionType action category
 * @param confidence confidence in [0, 1]
 * @param riskLevel risk of applying the action
 * @param reasoning human-readable reasoning
 * @param estimatedImpact human-readable expected effect
 * @param urgency urgency in [0, 1]
 * @param parameters action parameters (immutable copy)
 */
public record Recommendation(
    AgentType agentType,
    String incidentId,
    String actionId,
    ActionType actionType,
    double confidence,
    RiskLevel riskLevel,
    String reasoning,
    String estimatedImpact,
    double urgency,
    Map<String, Object> parameters) {

  public Recommendation {
    Objects.requireNonNull(agentType, "agentType");
    Objects.requireNonNull(actionType, "actionType");
    if (incidentId == null || incidentId.isBlank()) {
      throw new IllegalArgumentException("incidentId cannot be null or blank");
    }
    if (actionId == null || actionId.isBlank()) {
      throw new IllegalArgumentException("actionId cannot be null or blank");
    }
    requireUnitInterval("confidence", confidence);
    requireUnitInterval("urgency", urgency);
    riskLevel = riskLevel == null ? RiskLevel.MEDIUM : riskLevel;
    reasoning = reasoning == null ? "" : reasoning;
    estimatedImpact = estimatedImpact == null ? "" : estimatedImpact;
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  public static Builder builder(AgentType agentType, String incidentId) {
    return new Builder(agentType, incidentId);
  }

  private static void requireUnitInterval(String field, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(field + " must be within [0, 1]: " + value);
    }
  }

  public static final class Builder {
    private final AgentType agentType;
    private final String incidentId;
    private String actionId;
    private ActionType actionType = ActionType.NO_ACTION;
    private double confidence;
    private RiskLevel riskLevel = RiskLevel.MEDIUM;
    private String reasoning;
    private String estimatedImpact;
    private double urgency = 0.5;
    private Map<String, Object> parameters = Map.of();

    private Builder(AgentType agentType, String incidentId) {
      this.agentType = agentType;
      this.incidentId = incidentId;
    }

    public Builder actionId(String actionId) {
      this.actionId = actionId;
      return this;
    }

    public Builder actionType(ActionType actionType) {
      this.actionType = actionType;
      return this;
    }

    public Builder confidence(double confidence) {
      this.confidence = confidence;
      return this;
    }

    public Builder riskLevel(RiskLevel riskLevel) {
      this.riskLevel = riskLevel;
      return this;
    }

    public Builder reasoning(String reasoning) {
      this.reasoning = reasoning;
      return this;
    }

    public Builder estimatedImpact(String estimatedImpact) {
      this.estimatedImpact = estimatedImpact;
      return this;
    }

    public Builder urgency(double urgency) {
      this.urgency = urgency;
      return this;
    }

    public Builder parameters(Map<String, Object> parameters) {
      this.parameters = parameters;
      return this;
    }

    public Recommendation build() {
      return new Recommendation(
          agentType,
          incidentId,
          actionId,
          actionType,
          confidence,
          riskLevel,
          reasoning,
          estimatedImpact,
          urgency,
          parameters);
    }
  }
}
