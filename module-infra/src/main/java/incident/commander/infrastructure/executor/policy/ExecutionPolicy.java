package incident.commander.infrastructure.executor.policy;

import incident.commander.infrastructure.executor.TaskContext;

/**
 * Hook around a task executed by the {@link ExecutionPipeline}.
 *
 * <p>Hooks are best-effort: a hook failing with an {@link Exception} is logged and isolated, it
 * never changes the task's result. {@code after} is only called for policies whose {@code before}
 * completed.
 */
public interface ExecutionPolicy {

  default void before(TaskContext context) throws Exception {}

  default <T> void onSuccess(T result, long elapsedNanos, TaskContext context) throws Exception {}

  default void onFailure(Throwable error, long elapsedNanos, TaskContext context)
      throws Exception {}

  default void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context)
      throws Exception {}
}
