package incident.commander.core.domain.model.incident;

public enum IncidentStatus {
  DETECTED,
  ANALYZING,
  RESOLVING,
  RESOLVED,
  ESCALATED,
  FAILED;

  public boolean isTerminal() {
    return this == RESOLVED || this == ESCALATED || this == FAILED;
  }
}
