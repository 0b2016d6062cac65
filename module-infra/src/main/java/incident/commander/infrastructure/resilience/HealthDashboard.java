package incident.commander.infrastructure.resilience;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of every registered breaker.
 *
 * @param timestamp snapshot time
 * @param totalDependencies registered breakers
 * @param healthy breakers reporting {@link HealthStatus#HEALTHY}
 * @param degraded breakers reporting {@link HealthStatus#DEGRADED}
 * @param unhealthy breakers reporting {@link HealthStatus#UNHEALTHY}
 * @param dependencies per-dependency rows sorted by name
 */
public record HealthDashboard(
    Instant timestamp,
    int totalDependencies,
    int healthy,
    int degraded,
    int unhealthy,
    List<DependencyHealth> dependencies) {

  public HealthDashboard {
    dependencies = List.copyOf(dependencies);
  }

  public boolean allHealthy() {
    return degraded == 0 && unhealthy == 0;
  }
}
