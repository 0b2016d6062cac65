package incident.commander.infrastructure.messaging;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Supervised set of delayed redelivery tasks on a shared {@link ThreadPoolTaskScheduler}.
 *
 * <p>Each scheduled task removes itself from the pending set when it finishes. {@link #cancelAll()}
 * cancels whatever is still pending. The scheduler's lifecycle belongs to its owner.
 */
@Slf4j
public class RetryScheduler {

  private final ThreadPoolTaskScheduler scheduler;
  private final Set<ScheduledFuture<?>> pending = ConcurrentHashMap.newKeySet();
  private volatile boolean stopped;

  public RetryScheduler(ThreadPoolTaskScheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public void schedule(Runnable task, Duration delay, String description) {
    if (stopped) {
      log.debug("[RetryScheduler] skipped, stopped: {}", description);
      return;
    }
    AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
    ScheduledFuture<?> future =
        scheduler.schedule(
            () -> {
              try {
                task.run();
              } finally {
                ScheduledFuture<?> f = self.get();
                if (f != null) {
                  pending.remove(f);
                }
              }
            },
            scheduler.getClock().instant().plus(delay));
    self.set(future);
    pending.add(future);
    if (future.isDone()) {
      pending.remove(future);
    }
    log.debug("[RetryScheduler] scheduled: {}, delay={}ms", description, delay.toMillis());
  }

  public int pendingCount() {
    return pending.size();
  }

  /** Cancels pending retries, interrupting running ones, and refuses new ones. */
  public int cancelAll() {
    stopped = true;
    int cancelled = 0;
    for (ScheduledFuture<?> future : pending) {
      if (future.cancel(true)) {
        cancelled++;
      }
    }
    pending.clear();
    log.info("[RetryScheduler] stopped: cancelled={}", cancelled);
    return cancelled;
  }
}
