package incident.commander.infrastructure.resilience;

public enum CircuitBreakerState {
  /** Calls pass through; consecutive failures are counted. */
  CLOSED,
  /** Calls are rejected until the open timeout has elapsed since the last failure. */
  OPEN,
  /** Trial calls pass; successes close the breaker, any failure reopens it. */
  HALF_OPEN
}
