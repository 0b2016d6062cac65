package incident.commander.infrastructure.resilience;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Circuit breaker settings shared by every dependency.
 *
 * <pre>
 * incident:
 *   circuit-breaker:
 *     failure-threshold: 5    # consecutive failures before OPEN
 *     open-timeout: 30s       # OPEN -> HALF_OPEN after this long since the last failure
 *     success-threshold: 2    # HALF_OPEN successes before CLOSED
 *     call-timeout: 30s       # timeout for agent calls
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "incident.circuit-breaker")
public class CircuitBreakerProperties {

  @Min(1)
  private int failureThreshold = 5;

  @NotNull private Duration openTimeout = Duration.ofSeconds(30);

  @Min(1)
  private int successThreshold = 2;

  @NotNull private Duration callTimeout = Duration.ofSeconds(30);

  public static CircuitBreakerProperties defaults() {
    return new CircuitBreakerProperties();
  }
}
