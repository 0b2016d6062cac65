package incident.commander.infrastructure.executor.function;

/**
 * Void task that may throw any {@link Throwable}.
 *
 * <pre>{@code
 * executor.executeVoid(() -> transport.pushHead(queue, json, ttl),
 *     TaskContext.of("MessageBus", "PushHead", queue));
 * }</pre>
 *
 * @see java.lang.Runnable
 */
@FunctionalInterface
public interface ThrowingRunnable {

  void run() throws Throwable;
}
