package incident.commander.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Task logging settings.
 *
 * <pre>
 * executor:
 *   logging:
 *     slow-ms: 200
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "executor.logging")
public class ExecutorLoggingProperties {

  /** Successful tasks at or above this many ms are logged as SLOW (INFO). Range 0 to 60000. */
  @Min(0)
  @Max(60_000)
  private long slowMs = 200L;

  public long getSlowMs() {
    return slowMs;
  }

  public void setSlowMs(long slowMs) {
    this.slowMs = slowMs;
  }
}
