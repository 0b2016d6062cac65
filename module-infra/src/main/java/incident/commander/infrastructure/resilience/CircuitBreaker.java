package incident.commander.infrastructure.resilience;

import incident.commander.error.exception.CircuitBreakerOpenException;
import incident.commander.error.exception.DependencyTimeoutException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;
import incident.commander.infrastructure.executor.function.ThrowingSupplier;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Three-state circuit breaker for one named dependency, backed by a resilience4j breaker.
 *
 * <pre>
 * CLOSED --(failureThreshold consecutive failures)--> OPEN
 * OPEN --(openTimeout since last failure, checked in canExecute)--> HALF_OPEN
 * HALF_OPEN --(successThreshold consecutive successes)--> CLOSED
 * HALF_OPEN --(any failure)--> OPEN
 * </pre>
 *
 * <p>The resilience4j breaker runs a count-based window of {@code failureThreshold} calls with a
 * 100% failure-rate threshold, so it opens exactly on a full window of failures. OPEN to HALF_OPEN
 * is driven here from the injected {@link Clock} and the last failure time. This wrapper also keeps
 * the cumulative counters reported by {@link #stats()}.
 *
 * <p>Exceptions marked with {@link CircuitBreakerIgnoreMarker} are rethrown without being recorded.
 */
@Slf4j
public class CircuitBreaker {

  private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
  private final Duration openTimeout;
  private final Clock clock;
  private final BiConsumer<CircuitBreakerState, CircuitBreakerState> transitionListener;

  private final ReentrantLock lock = new ReentrantLock();

  private long totalCalls;
  private long successCalls;
  private long failureCalls;
  private int consecutiveFailures;
  private Instant lastFailureAt;
  private Instant lastSuccessAt;
  private long stateTransitions;
  private boolean resetting;

  public CircuitBreaker(String name, CircuitBreakerProperties properties, Clock clock) {
    this(name, properties, clock, (from, to) -> {});
  }

  public CircuitBreaker(
      String name,
      CircuitBreakerProperties properties,
      Clock clock,
      BiConsumer<CircuitBreakerState, CircuitBreakerState> transitionListener) {
    this(
        io.github.resilience4j.circuitbreaker.CircuitBreaker.of(
            Objects.requireNonNull(name, "name"), config(properties)),
        properties,
        clock,
        transitionListener);
  }

  CircuitBreaker(
      io.github.resilience4j.circuitbreaker.CircuitBreaker delegate,
      CircuitBreakerProperties properties,
      Clock clock,
      BiConsumer<CircuitBreakerState, CircuitBreakerState> transitionListener) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.openTimeout = properties.getOpenTimeout();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transitionListener = Objects.requireNonNull(transitionListener, "transitionListener");
    delegate
        .getEventPublisher()
        .onStateTransition(
            event ->
                onTransition(
                    map(event.getStateTransition().getFromState()),
                    map(event.getStateTransition().getToState())));
  }

  /**
   * resilience4j settings equivalent to the consecutive-failure state machine above. Automatic
   * OPEN to HALF_OPEN is off; {@link #canExecute()} performs it.
   */
  public static CircuitBreakerConfig config(CircuitBreakerProperties properties) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(properties.getFailureThreshold())
        .minimumNumberOfCalls(properties.getFailureThreshold())
        .failureRateThreshold(100)
        .waitDurationInOpenState(properties.getOpenTimeout())
        .automaticTransitionFromOpenToHalfOpenEnabled(false)
        .permittedNumberOfCallsInHalfOpenState(properties.getSuccessThreshold())
        .build();
  }

  /**
   * Invokes the operation if the breaker allows it.
   *
   * @throws CircuitBreakerOpenException when rejected; the operation is not invoked
   * @throws Exception the operation's own failure, after it has been recorded
   */
  public <T> T call(ThrowingSupplier<T> operation) throws Exception {
    if (!canExecute()) {
      throw new CircuitBreakerOpenException(name());
    }
    T result;
    try {
      result = operation.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      if (!(t instanceof CircuitBreakerIgnoreMarker)) {
        recordFailure(t);
      }
      throw asException(t);
    }
    recordSuccess();
    return result;
  }

  /**
   * Invokes the operation on {@code executor} under a resilience4j {@link TimeLimiter}. A timeout is
   * recorded as a failure and raised as {@link DependencyTimeoutException}; the running task is
   * cancelled.
   */
  public <T> T call(Callable<T> operation, Duration timeout, ExecutorService executor)
      throws Exception {
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            name(),
            TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    return call(
        () -> {
          try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(operation));
          } catch (TimeoutException e) {
            throw new DependencyTimeoutException(name(), timeout.toMillis(), e);
          }
        });
  }

  /** Whether a call may proceed now. Moves OPEN to HALF_OPEN once the open timeout elapsed. */
  public boolean canExecute() {
    lock.lock();
    try {
      CircuitBreakerState state = state();
      if (state != CircuitBreakerState.OPEN) {
        return true;
      }
      if (lastFailureAt != null && !clock.instant().isBefore(lastFailureAt.plus(openTimeout))) {
        delegate.transitionToHalfOpenState();
        return true;
      }
      return false;
    } finally {
      lock.unlock();
    }
  }

  public void recordSuccess() {
    lock.lock();
    try {
      totalCalls++;
      successCalls++;
      consecutiveFailures = 0;
      lastSuccessAt = clock.instant();
      delegate.onSuccess(0, TimeUnit.NANOSECONDS);
    } finally {
      lock.unlock();
    }
  }

  public void recordFailure() {
    recordFailure(new IllegalStateException("failure recorded for " + name()));
  }

  public void recordFailure(Throwable cause) {
    lock.lock();
    try {
      totalCalls++;
      failureCalls++;
      consecutiveFailures++;
      lastFailureAt = clock.instant();
      // one failed half-open call reopens, without waiting for the half-open window to fill
      if (delegate.getState() == State.HALF_OPEN) {
        delegate.transitionToOpenState();
      }
      delegate.onError(0, TimeUnit.NANOSECONDS, cause);
    } finally {
      lock.unlock();
    }
  }

  /** Administrative reset: CLOSED with fresh counters. Not counted as a transition. */
  public void reset() {
    lock.lock();
    try {
      CircuitBreakerState previous = state();
      resetting = true;
      try {
        delegate.reset();
      } finally {
        resetting = false;
      }
      totalCalls = 0;
      successCalls = 0;
      failureCalls = 0;
      consecutiveFailures = 0;
      lastFailureAt = null;
      lastSuccessAt = null;
      stateTransitions = 0;
      log.info("[CircuitBreaker] reset: name={}, previousState={}", name(), previous);
    } finally {
      lock.unlock();
    }
  }

  public CircuitBreakerState state() {
    return map(delegate.getState());
  }

  public CircuitBreakerStats stats() {
    lock.lock();
    try {
      return new CircuitBreakerStats(
          totalCalls,
          successCalls,
          failureCalls,
          consecutiveFailures,
          lastFailureAt,
          lastSuccessAt,
          stateTransitions);
    } finally {
      lock.unlock();
    }
  }

  public String name() {
    return delegate.getName();
  }

  // runs on the thread that caused the transition, which holds the lock
  private void onTransition(CircuitBreakerState previous, CircuitBreakerState next) {
    if (resetting || previous == next) {
      return;
    }
    stateTransitions++;
    if (next == CircuitBreakerState.OPEN) {
      log.warn(
          "[CircuitBreaker] {} -> OPEN: name={}, consecutiveFailures={}",
          previous,
          name(),
          consecutiveFailures);
    } else {
      log.info("[CircuitBreaker] {} -> {}: name={}", previous, next, name());
    }
    transitionListener.accept(previous, next);
  }

  private static CircuitBreakerState map(State state) {
    return switch (state) {
      case OPEN, FORCED_OPEN -> CircuitBreakerState.OPEN;
      case HALF_OPEN -> CircuitBreakerState.HALF_OPEN;
      default -> CircuitBreakerState.CLOSED;
    };
  }

  private static Exception asException(Throwable t) {
    if (t instanceof Exception e) {
      return e;
    }
    return new IllegalStateException(t);
  }
}
