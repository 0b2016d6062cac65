package incident.commander.infrastructure.resilience;

import incident.commander.core.domain.model.agent.AgentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazily creates and tracks one {@link CircuitBreaker} per dependency name. Each one wraps the
 * resilience4j breaker of the same name from a shared resilience4j registry built from {@link
 * CircuitBreaker#config(CircuitBreakerProperties)}.
 *
 * <p>Breakers created here publish a {@code circuit.breaker.state} gauge (0 closed, 1 open, 2
 * half-open) and a {@code circuit.breaker.transitions} counter when a {@link MeterRegistry} is
 * available.
 */
@Slf4j
public class CircuitBreakerRegistry {

  public static final String AGENT_PREFIX = "agent_";
  public static final double DEGRADED_FAILURE_RATE = 0.3;

  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
  private final io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry delegates;
  private final CircuitBreakerProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public CircuitBreakerRegistry(CircuitBreakerProperties properties) {
    this(properties, Clock.systemUTC(), null);
  }

  public CircuitBreakerRegistry(
      CircuitBreakerProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.delegates =
        io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry.of(
            CircuitBreaker.config(properties));
    this.clock = Objects.requireNonNull(clock, "clock");
    this.meterRegistry = meterRegistry;
  }

  public CircuitBreaker breaker(String name) {
    return breakers.computeIfAbsent(name, this::create);
  }

  public CircuitBreaker agentBreaker(AgentType agentType) {
    return breaker(AGENT_PREFIX + agentType.value());
  }

  public Map<String, CircuitBreakerStats> allStats() {
    Map<String, CircuitBreakerStats> stats = new TreeMap<>();
    breakers.forEach((name, breaker) -> stats.put(name, breaker.stats()));
    return stats;
  }

  /** Names of breakers currently OPEN. */
  public List<String> unhealthyDependencies() {
    return breakers.values().stream()
        .filter(b -> b.state() == CircuitBreakerState.OPEN)
        .map(CircuitBreaker::name)
        .sorted()
        .toList();
  }

  public void resetAll() {
    breakers.values().forEach(CircuitBreaker::reset);
    log.info("[CircuitBreakerRegistry] all breakers reset: count={}", breakers.size());
  }

  public HealthDashboard healthDashboard() {
    List<DependencyHealth> rows =
        breakers.values().stream()
            .map(CircuitBreakerRegistry::health)
            .sorted(Comparator.comparing(DependencyHealth::name))
            .toList();

    int healthy = count(rows, HealthStatus.HEALTHY);
    int degraded = count(rows, HealthStatus.DEGRADED);
    int unhealthy = count(rows, HealthStatus.UNHEALTHY);
    return new HealthDashboard(clock.instant(), rows.size(), healthy, degraded, unhealthy, rows);
  }

  /** The underlying resilience4j registry, for binding its own event consumers or metrics. */
  public io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry delegates() {
    return delegates;
  }

  public int size() {
    return breakers.size();
  }

  private CircuitBreaker create(String name) {
    if (meterRegistry == null) {
      log.debug("[CircuitBreakerRegistry] breaker created: name={}", name);
      return new CircuitBreaker(
          delegates.circuitBreaker(name), properties, clock, (from, to) -> {});
    }
    CircuitBreaker breaker =
        new CircuitBreaker(
            delegates.circuitBreaker(name),
            properties,
            clock,
            (from, to) ->
                Counter.builder("circuit.breaker.transitions")
                    .tag("name", name)
                    .tag("to", to.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry)
                    .increment());
    Gauge.builder("circuit.breaker.state", breaker, b -> b.state().ordinal())
        .tag("name", name)
        .description("0=closed, 1=open, 2=half_open")
        .register(meterRegistry);
    log.debug("[CircuitBreakerRegistry] breaker created: name={}", name);
    return breaker;
  }

  private static DependencyHealth health(CircuitBreaker breaker) {
    CircuitBreakerState state = breaker.state();
    CircuitBreakerStats stats = breaker.stats();
    HealthStatus status;
    String recommendation;
    if (state == CircuitBreakerState.OPEN) {
      status = HealthStatus.UNHEALTHY;
      recommendation = "Dependency is failing; calls are short-circuited. Check its availability.";
    } else if (stats.failureRate() > DEGRADED_FAILURE_RATE) {
      status = HealthStatus.DEGRADED;
      recommendation = "Elevated failure rate; monitor closely.";
    } else if (state == CircuitBreakerState.HALF_OPEN) {
      status = HealthStatus.HEALTHY;
      recommendation = "Recovering; trial calls in progress.";
    } else {
      status = HealthStatus.HEALTHY;
      recommendation = "No action needed.";
    }
    return new DependencyHealth(
        breaker.name(),
        state,
        status,
        stats.failureRate(),
        stats.totalCalls(),
        stats.lastFailureAt(),
        recommendation);
  }

  private static int count(List<DependencyHealth> rows, HealthStatus status) {
    return (int) rows.stream().filter(r -> r.status() == status).count();
  }
}
