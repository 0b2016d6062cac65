package incident.commander.infrastructure.messaging;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Message bus settings.
 *
 * <pre>
 * incident:
 *   message-bus:
 *     transport: redis-sqs        # or in-memory
 *     queue-prefix: incident_commander
 *     default-ttl: 300s
 *     max-retries: 3              # handler retries per envelope
 *     send-attempts: 4            # sendWithResilience: 1 + 3 retries
 *     send-base-delay: 1s
 *     receive-threads: 16         # upper bound on concurrent receive loops
 *     retry-threads: 2            # delayed redelivery scheduler
 *     sqs:
 *       region: us-east-1
 *       endpoint:                 # optional, e.g. LocalStack
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "incident.message-bus")
public class MessageBusProperties {

  @NotNull private TransportType transport = TransportType.IN_MEMORY;

  @NotBlank private String queuePrefix = QueueNames.DEFAULT_PREFIX;

  @NotNull private Duration defaultTtl = Duration.ofSeconds(300);

  @Min(0)
  private int maxRetries = 3;

  @Min(1)
  private int sendAttempts = 4;

  @NotNull private Duration sendBaseDelay = Duration.ofSeconds(1);

  @NotNull private Duration handlerRetryBaseDelay = Duration.ofSeconds(1);

  @NotNull private Duration handlerRetryMaxDelay = Duration.ofSeconds(300);

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double jitterFactor = 0.1;

  @Min(0)
  private int durableWaitSeconds = 5;

  @NotNull private Duration idlePoll = Duration.ofMillis(500);

  @NotNull private Duration subscriberBaseBackoff = Duration.ofMillis(500);

  @NotNull private Duration subscriberMaxBackoff = Duration.ofSeconds(30);

  @Min(1)
  private int unhealthyThreshold = 10;

  @NotNull private Duration deadLetterRetention = Duration.ofDays(7);

  @NotNull private Duration shutdownTimeout = Duration.ofSeconds(10);

  @Min(1)
  private int receiveThreads = 16;

  @Min(1)
  private int retryThreads = 2;

  @Valid private Sqs sqs = new Sqs();

  @Getter
  @Setter
  public static class Sqs {
    @NotBlank private String region = "us-east-1";

    /** Endpoint override; blank uses the regional AWS endpoint. */
    private String endpoint;
  }
}
