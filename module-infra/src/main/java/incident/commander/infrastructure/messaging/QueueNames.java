package incident.commander.infrastructure.messaging;

import java.util.Objects;

/** {@code <prefix>_<agent>} and {@code <prefix>_<agent>_dlq}. */
public final class QueueNames {

  public static final String DEFAULT_PREFIX = "incident_commander";
  public static final String DLQ_SUFFIX = "_dlq";

  private final String prefix;

  public QueueNames(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  public String queue(String agentName) {
    return prefix + "_" + agentName;
  }

  public String deadLetterQueue(String agentName) {
    return queue(agentName) + DLQ_SUFFIX;
  }
}
