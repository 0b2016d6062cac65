package incident.commander.core.domain.model.agent;

import incident.commander.core.domain.model.incident.IncidentSeverity;

public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean isHighOrCritical() {
    return this == HIGH || this == CRITICAL;
  }

  public static RiskLevel fromSeverity(IncidentSeverity severity) {
    return valueOf(severity.name());
  }
}
