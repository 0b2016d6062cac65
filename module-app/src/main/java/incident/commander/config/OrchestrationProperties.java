package incident.commander.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Orchestration settings.
 *
 * <pre>
 * incident:
 *   orchestration:
 *     stage-timeout: 30s     # per agent call
 *     executor-threads: 8    # size of each orchestration pool
 *     publish-summary: true  # communication stage publishes incident.summary on the bus
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "incident.orchestration")
public class OrchestrationProperties {

  @NotNull private Duration stageTimeout = Duration.ofSeconds(30);

  @Min(1)
  private int executorThreads = 8;

  private boolean publishSummary = true;
}
