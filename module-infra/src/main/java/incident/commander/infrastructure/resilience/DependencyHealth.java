package incident.commander.infrastructure.resilience;

import java.time.Instant;

/**
 * Dashboard row for one dependency.
 *
 * @param name dependency (breaker) name
 * @param state current breaker state
 * @param status derived health
 * @param failureRate failures / total calls
 * @param totalCalls completed calls
 * @param lastFailureAt time of the last failure, {@code null} if none
 * @param recommendation operator hint for the current status
 */
public record DependencyHealth(
    String name,
    CircuitBreakerState state,
    HealthStatus status,
    double failureRate,
    long totalCalls,
    Instant lastFailureAt,
    String recommendation) {}
