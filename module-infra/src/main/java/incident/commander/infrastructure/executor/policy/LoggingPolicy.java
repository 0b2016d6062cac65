package incident.commander.infrastructure.executor.policy;

import static incident.commander.infrastructure.executor.policy.TaskLogTags.TAG_AFTER;
import static incident.commander.infrastructure.executor.policy.TaskLogTags.TAG_FAILURE;
import static incident.commander.infrastructure.executor.policy.TaskLogTags.TAG_SLOW;
import static incident.commander.infrastructure.executor.policy.TaskLogTags.TAG_START;
import static incident.commander.infrastructure.executor.policy.TaskLogTags.TAG_SUCCESS;

import incident.commander.error.exception.base.ClientBaseException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;
import incident.commander.infrastructure.executor.TaskContext;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-phase task logging (stateless).
 *
 * <p>- before: [Task:START] {taskName} -> DEBUG - onSuccess: [Task:SUCCESS] -> DEBUG, or
 * [Task:SLOW] -> INFO above the threshold - onFailure: [Task:FAILURE] -> WARN for expected
 * rejections (breaker open, client errors), ERROR with stack trace otherwise - after: [Task:AFTER]
 * {taskName}, outcome=... -> DEBUG
 */
@Slf4j
public class LoggingPolicy implements ExecutionPolicy {

  private static final long MAX_SLOW_MS = 60_000L;

  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /**
   * @param slowMs slow threshold in ms; 0 or less disables SLOW promotion
   */
  public LoggingPolicy(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));

    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  @Override
  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}", TAG_START, TaskLogSupport.safeTaskName(context));
  }

  @Override
  public <T> void onSuccess(T ignored, long elapsedNanos, TaskContext context) {
    boolean slow = slowEnabled && elapsedNanos >= slowThresholdNanos;

    if (slow) {
      log.info(
          "{} {}, elapsed={}, threshold={}ms",
          TAG_SLOW,
          TaskLogSupport.safeTaskName(context),
          formatDuration(elapsedNanos),
          slowThresholdMs);
      return;
    }

    if (!log.isDebugEnabled()) return;
    log.debug(
        "{} {}, elapsed={}",
        TAG_SUCCESS,
        TaskLogSupport.safeTaskName(context),
        formatDuration(elapsedNanos));
  }

  @Override
  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String taskName = TaskLogSupport.safeTaskName(context);
    String elapsed = formatDuration(elapsedNanos);
    String errorType = (error != null) ? error.getClass().getSimpleName() : "UnknownError";

    if (isExpected(error)) {
      log.warn(
          "{} {}, elapsed={}, errorType={}, message={}",
          TAG_FAILURE,
          taskName,
          elapsed,
          errorType,
          error.getMessage());
      return;
    }
    log.error("{} {}, elapsed={}, errorType={}", TAG_FAILURE, taskName, elapsed, errorType, error);
  }

  @Override
  public void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug(
        "{} {}, outcome={}, elapsed={}",
        TAG_AFTER,
        TaskLogSupport.safeTaskName(context),
        outcome,
        formatDuration(elapsedNanos));
  }

  private static boolean isExpected(Throwable error) {
    return error instanceof CircuitBreakerIgnoreMarker || error instanceof ClientBaseException;
  }

  private static String formatDuration(long elapsedNanos) {
    return String.format(Locale.ROOT, "%.3fms", elapsedNanos / 1_000_000d);
  }
}
