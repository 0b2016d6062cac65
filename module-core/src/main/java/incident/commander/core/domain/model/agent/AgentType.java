package incident.commander.core.domain.model.agent;

import java.util.Locale;

public enum AgentType {
  DETECTION,
  DIAGNOSIS,
  PREDICTION,
  RESOLUTION,
  COMMUNICATION;

  /** Wire value, also used in queue and breaker names. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AgentType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("agent type cannot be null or blank");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
