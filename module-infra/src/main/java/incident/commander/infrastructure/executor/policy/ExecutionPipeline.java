package incident.commander.infrastructure.executor.policy;

import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.infrastructure.executor.function.ThrowingSupplier;
import incident.commander.infrastructure.util.InterruptUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a task between the hooks of an ordered policy list.
 *
 * <ol>
 *   <li>BEFORE in declaration order; only policies whose before completed are "entered"
 *   <li>TASK, then ON_SUCCESS or ON_FAILURE on entered policies
 *   <li>AFTER on entered policies in reverse order
 * </ol>
 *
 * <p>The task's own Throwable is rethrown untouched. Hook exceptions are isolated and logged; hook
 * {@link Error}s are propagated.
 */
@Slf4j
public class ExecutionPipeline {

  private final List<ExecutionPolicy> policies;

  public ExecutionPipeline(List<ExecutionPolicy> policies) {
    Objects.requireNonNull(policies, "policies must not be null");
    this.policies = List.copyOf(policies);
  }

  public <T> T executeRaw(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    List<ExecutionPolicy> entered = new ArrayList<>(policies.size());
    for (ExecutionPolicy policy : policies) {
      if (runHook(policy, "before", context, () -> policy.before(context))) {
        entered.add(policy);
      }
    }

    long start = System.nanoTime();
    ExecutionOutcome outcome = ExecutionOutcome.FAILURE;
    try {
      T result = task.get();
      long elapsed = System.nanoTime() - start;
      outcome = ExecutionOutcome.SUCCESS;
      for (ExecutionPolicy policy : entered) {
        runHook(policy, "onSuccess", context, () -> policy.onSuccess(result, elapsed, context));
      }
      return result;
    } catch (Throwable t) {
      InterruptUtils.restoreInterruptIfNeeded(t);
      long elapsed = System.nanoTime() - start;
      for (ExecutionPolicy policy : entered) {
        runHook(policy, "onFailure", context, () -> policy.onFailure(t, elapsed, context));
      }
      throw t;
    } finally {
      long elapsed = System.nanoTime() - start;
      ExecutionOutcome finalOutcome = outcome;
      for (int i = entered.size() - 1; i >= 0; i--) {
        ExecutionPolicy policy = entered.get(i);
        runHook(policy, "after", context, () -> policy.after(finalOutcome, elapsed, context));
      }
    }
  }

  /** Returns false when the hook failed with an Exception (isolated and logged). */
  private static boolean runHook(
      ExecutionPolicy policy, String hook, TaskContext context, Hook body) {
    try {
      body.run();
      return true;
    } catch (Exception e) {
      InterruptUtils.restoreInterruptIfNeeded(e);
      log.warn(
          "[Pipeline:HOOK_FAILURE] policy={}, hook={}, taskName={}",
          policy.getClass().getSimpleName(),
          hook,
          TaskLogSupport.safeTaskName(context),
          e);
      return false;
    }
  }

  @FunctionalInterface
  private interface Hook {
    void run() throws Exception;
  }
}
