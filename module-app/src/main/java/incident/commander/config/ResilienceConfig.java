package incident.commander.config;

import incident.commander.infrastructure.resilience.CircuitBreakerProperties;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Circuit breakers and the resilience4j retry registry.
 *
 * <p>Retry instances are created by their owners with explicit configs; the registry only keeps
 * them under one name each.
 */
@Configuration
@EnableConfigurationProperties(CircuitBreakerProperties.class)
public class ResilienceConfig {

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(
      CircuitBreakerProperties properties, Clock clock, MeterRegistry meterRegistry) {
    return new CircuitBreakerRegistry(properties, clock, meterRegistry);
  }

  @Bean
  public RetryRegistry retryRegistry() {
    return RetryRegistry.ofDefaults();
  }
}
