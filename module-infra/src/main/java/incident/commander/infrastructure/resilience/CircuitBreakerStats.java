package incident.commander.infrastructure.resilience;

import java.time.Instant;

/**
 * Point-in-time counters of one breaker.
 *
 * @param totalCalls calls that were allowed through and completed
 * @param successCalls successful calls
 * @param failureCalls failed calls
 * @param consecutiveFailures failures since the last success
 * @param lastFailureAt time of the last failure, {@code null} if none
 * @param lastSuccessAt time of the last success, {@code null} if none
 * @param stateTransitions number of state transitions since creation or reset
 */
public record CircuitBreakerStats(
    long totalCalls,
    long successCalls,
    long failureCalls,
    int consecutiveFailures,
    Instant lastFailureAt,
    Instant lastSuccessAt,
    long stateTransitions) {

  public static final CircuitBreakerStats EMPTY =
      new CircuitBreakerStats(0, 0, 0, 0, null, null, 0);

  public double failureRate() {
    return totalCalls == 0 ? 0.0 : (double) failureCalls / totalCalls;
  }

  public double successRate() {
    return totalCalls == 0 ? 0.0 : (double) successCalls / totalCalls;
  }
}
