package incident.commander.agent;

import incident.commander.core.domain.model.incident.IncidentSeverity;
import java.util.Locale;

/** Lenient readers for loosely typed context values. */
final class AgentContexts {

  private AgentContexts() {}

  static int intValue(Object value, int defaultValue) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }

  static double bySeverity(
      IncidentSeverity severity, double critical, double high, double medium, double low) {
    return switch (severity) {
      case CRITICAL -> critical;
      case HIGH -> high;
      case MEDIUM -> medium;
      case LOW -> low;
    };
  }

  static String lower(String text) {
    return text == null ? "" : text.toLowerCase(Locale.ROOT);
  }
}
