package incident.commander.infrastructure.resilience;

public enum HealthStatus {
  HEALTHY,
  /** Not OPEN, but failing more than the degraded threshold. */
  DEGRADED,
  /** Breaker is OPEN. */
  UNHEALTHY
}
