package incident.commander.infrastructure.executor.policy;

import incident.commander.infrastructure.executor.TaskContext;
import java.util.regex.Pattern;

/** Logging helpers shared by execution policies. */
public final class TaskLogSupport {

  private static final String UNKNOWN = "unknown";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TaskLogSupport() {}

  /**
   * Task name for log lines. Never throws: a broken context degrades to {@code "unknown"}.
   *
   * @param context task context (nullable)
   * @return normalized task name
   */
  public static String safeTaskName(TaskContext context) {
    if (context == null) return UNKNOWN;

    try {
      String name = context.toTaskName();
      if (name == null) return UNKNOWN;

      // collapse control characters and whitespace for log parsers
      String normalized = WHITESPACE.matcher(name).replaceAll(" ").trim();
      return normalized.isEmpty() ? UNKNOWN : normalized;
    } catch (RuntimeException e) {
      return UNKNOWN + "(" + context.getClass().getSimpleName() + ")";
    }
  }
}
