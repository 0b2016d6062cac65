package incident.commander.infrastructure.messaging;

import java.util.Locale;

public enum MessagePriority {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /** Urgent messages jump to the head of the low-latency queue. */
  public boolean isUrgent() {
    return this == HIGH || this == CRITICAL;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MessagePriority fromValue(String value) {
    if (value == null || value.isBlank()) {
      return MEDIUM;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
