package incident.commander.core.domain.model.incident;

import java.util.Locale;

/** Ordered severity: declaration order is the comparison order. */
public enum IncidentSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  public boolean isAtLeast(IncidentSeverity other) {
    return compareTo(other) >= 0;
  }

  public boolean isHighOrCritical() {
    return isAtLeast(HIGH);
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static IncidentSeverity fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("severity cannot be null or blank");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
