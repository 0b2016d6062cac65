package incident.commander.infrastructure.messaging;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff schedules used by the bus.
 *
 * <p>Send retries and handler retries share one shape: exponential with base 2 and symmetric
 * jitter, from resilience4j {@link IntervalFunction}. Handler retries are additionally capped.
 * The receive loop uses an additive-jitter backoff of its own.
 */
public final class BackoffPolicy {

  private static final double MULTIPLIER = 2.0;

  private final IntervalFunction sendInterval;
  private final IntervalFunction handlerInterval;
  private final long handlerMaxMillis;
  private final long subscriberBaseMillis;
  private final long subscriberMaxMillis;

  public BackoffPolicy(MessageBusProperties properties) {
    this.sendInterval =
        IntervalFunction.ofExponentialRandomBackoff(
            properties.getSendBaseDelay().toMillis(), MULTIPLIER, properties.getJitterFactor());
    this.handlerInterval =
        IntervalFunction.ofExponentialRandomBackoff(
            properties.getHandlerRetryBaseDelay().toMillis(),
            MULTIPLIER,
            properties.getJitterFactor());
    this.handlerMaxMillis = properties.getHandlerRetryMaxDelay().toMillis();
    this.subscriberBaseMillis = properties.getSubscriberBaseBackoff().toMillis();
    this.subscriberMaxMillis = properties.getSubscriberMaxBackoff().toMillis();
  }

  /** Wait between resilient-send attempts; attempt 1 waits the base delay. */
  public IntervalFunction sendInterval() {
    return sendInterval;
  }

  /** Delay before redelivering an envelope whose retry counter is now {@code retryCount}. */
  public Duration handlerRetryDelay(int retryCount) {
    long millis = handlerInterval.apply(retryCount + 1);
    return Duration.ofMillis(Math.min(handlerMaxMillis, millis));
  }

  /** {@code min(max, base * 2^failures) + uniform(0, base)} after consecutive loop failures. */
  public Duration subscriberBackoff(int consecutiveFailures) {
    double exponential = subscriberBaseMillis * Math.pow(MULTIPLIER, consecutiveFailures);
    long capped = (long) Math.min(subscriberMaxMillis, exponential);
    long jitter =
        subscriberBaseMillis <= 0 ? 0 : ThreadLocalRandom.current().nextLong(subscriberBaseMillis);
    return Duration.ofMillis(capped + jitter);
  }
}
