package incident.commander.infrastructure.util;

import java.io.InterruptedIOException;

/**
 * Restores the interrupt flag when an InterruptedException (or InterruptedIOException) is found
 * anywhere in a throwable's cause chain or suppressed list.
 */
public final class InterruptUtils {

  /** Traversal depth limit for cyclic cause graphs. */
  private static final int MAX_GRAPH_DEPTH = 32;

  private InterruptUtils() {}

  public static void restoreInterruptIfNeeded(Throwable t) {
    if (t != null && containsInterrupted(t, 0)) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean containsInterrupted(Throwable t, int depth) {
    if (t == null || depth >= MAX_GRAPH_DEPTH) return false;
    if (t instanceof InterruptedException || t instanceof InterruptedIOException) return true;

    for (Throwable s : t.getSuppressed()) {
      if (containsInterrupted(s, depth + 1)) return true;
    }
    return containsInterrupted(t.getCause(), depth + 1);
  }
}
