package incident.commander.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import incident.commander.error.exception.InternalSystemException;
import incident.commander.error.exception.base.BaseException;
import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.infrastructure.util.ExceptionUtils;

/** Translates a task failure into a domain RuntimeException. */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Decorator applied by every factory:
   *
   * <ol>
   *   <li>Error is rethrown
   *   <li>CompletionException / ExecutionException are unwrapped
   *   <li>domain exceptions and other RuntimeExceptions pass through
   *   <li>remaining checked exceptions go to {@code inner}
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof Error err) {
        throw err;
      }
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      if (unwrapped instanceof RuntimeException re) {
        return re;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** Default: checked exceptions become {@link InternalSystemException} tagged with the task. */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  /** Envelope (de)serialization failures. */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          String kind = unwrapped instanceof JsonProcessingException ? "json" : "io";
          return new InternalSystemException(kind + ":" + context.toTaskName(), unwrapped);
        });
  }
}
