package incident.commander.core.domain.model.agent;

import java.util.Locale;

/** Closed set of remediation actions an agent may recommend. */
public enum ActionType {
  ESCALATE_INCIDENT,
  RESTART_SERVICE,
  SCALE_UP,
  SCALE_DOWN,
  INCREASE_CAPACITY,
  ROLLBACK_DEPLOYMENT,
  CIRCUIT_BREAKER_OPEN,
  NOTIFY_TEAM,
  NO_ACTION;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ActionType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("action type cannot be null or blank");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
