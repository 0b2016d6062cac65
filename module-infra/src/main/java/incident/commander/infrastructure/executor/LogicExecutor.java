package incident.commander.infrastructure.executor;

import incident.commander.infrastructure.executor.function.ThrowingRunnable;
import incident.commander.infrastructure.executor.function.ThrowingSupplier;
import incident.commander.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * Template for running logic without hand-written try/catch.
 *
 * <p>Every call goes through the {@link
 * incident.commander.infrastructure.executor.policy.ExecutionPipeline}: policies observe the task
 * (logging, timing), checked exceptions are translated into domain {@code RuntimeException}s, and
 * {@link Error}s are always rethrown untouched.
 *
 * <pre>{@code
 * // propagate (translated)
 * executor.executeVoid(() -> transport.send(url, body, attrs),
 *     TaskContext.of("MessageBus", "DurableSend", recipient));
 *
 * // recover
 * long length = executor.executeOrDefault(() -> transport.length(queue), 0L,
 *     TaskContext.of("MessageBus", "QueueLength", queue));
 * }</pre>
 */
public interface LogicExecutor {

  /** Runs the task and rethrows its failure after translation. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** Runs the task; on failure passes the translated exception to {@code recovery}. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** Runs the task; on failure returns {@code defaultValue}. */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** Runs the task and translates failures with a call-specific translator. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  /** Runs the task; on failure passes the raw (untranslated) exception to {@code fallback}. */
  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
