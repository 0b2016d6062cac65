package incident.commander.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Unwraps async wrapper exceptions down to the failure that actually happened. */
public final class ExceptionUtils {

  private static final int MAX_UNWRAP_DEPTH = 10;

  private ExceptionUtils() {}

  /**
   * Unwraps CompletionException and ExecutionException.
   *
   * @param throwable exception to unwrap
   * @return the root cause, or the original if it is not a wrapper
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = throwable;
    int depth = 0;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && depth++ < MAX_UNWRAP_DEPTH) {
      if (cause.getCause() == null) {
        return cause;
      }
      cause = cause.getCause();
    }
    return cause;
  }

  /** Message of the unwrapped failure, or its type name when it has none. */
  public static String describe(Throwable throwable) {
    Throwable root = unwrapAsyncException(throwable);
    if (root == null) {
      return "unknown";
    }
    String message = root.getMessage();
    return (message == null || message.isBlank()) ? root.getClass().getSimpleName() : message;
  }
}
