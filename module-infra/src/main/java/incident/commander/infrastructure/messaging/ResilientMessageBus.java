package incident.commander.infrastructure.messaging;

import incident.commander.error.exception.MessageBusException;
import incident.commander.error.exception.MessageDeliveryException;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.executor.TaskContext;
import incident.commander.infrastructure.executor.strategy.ExceptionTranslator;
import incident.commander.infrastructure.messaging.transport.DurableMessage;
import incident.commander.infrastructure.messaging.transport.DurableTransport;
import incident.commander.infrastructure.messaging.transport.LowLatencyTransport;
import incident.commander.infrastructure.resilience.CircuitBreaker;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import incident.commander.infrastructure.util.ExceptionUtils;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Dual-transport message bus.
 *
 * <h3>Send</h3>
 *
 * <ul>
 *   <li>low-latency transport first: HIGH/CRITICAL at the head, others at the tail, queue TTL =
 *       remaining message TTL (at least 1s)
 *   <li>any low-latency failure (breaker open included) falls through to the durable transport
 *   <li>both failing raises {@link MessageDeliveryException}; {@code unhealthyThreshold}
 *       consecutive failures mark the bus unhealthy
 * </ul>
 *
 * <h3>Receive (one loop per subscribed agent)</h3>
 *
 * <ul>
 *   <li>poll low-latency, else long-poll durable (deleted right after read)
 *   <li>expired envelopes are dropped without reaching the handler
 *   <li>no handler: dead-letter with {@value #NO_HANDLER}
 *   <li>handler failure: redeliver later with backoff while retries and TTL remain, else
 *       dead-letter
 * </ul>
 *
 * <p>Every transport call runs through the transport's circuit breaker. Transport errors never
 * escape the receive path. Receive loops and delayed retries run on pools owned by the caller;
 * {@link #shutdown()} stops the bus's own tasks and leaves the pools running.
 */
@Slf4j
public class ResilientMessageBus implements MessageBus {

  public static final String LOW_LATENCY_BREAKER = "low_latency_transport";
  public static final String DURABLE_BREAKER = "durable_transport";
  public static final String NO_HANDLER = "No message handler";
  static final String SEND_RETRY_NAME = "messageBusSend";
  private static final Duration MIN_QUEUE_TTL = Duration.ofSeconds(1);
  private static final String COMPONENT = "MessageBus";

  private final LowLatencyTransport lowLatency;
  private final DurableTransport durable;
  private final CircuitBreakerRegistry breakers;
  private final EnvelopeCodec codec;
  private final LogicExecutor executor;
  private final MessageBusProperties properties;
  private final Clock clock;
  private final QueueNames queueNames;
  private final BackoffPolicy backoff;
  private final Retry sendRetry;
  private final RetryScheduler retryScheduler;
  private final AsyncTaskExecutor receiveExecutor;

  private final Map<String, MessageHandler> handlers = new ConcurrentHashMap<>();
  private final Map<String, Subscription> subscribers = new ConcurrentHashMap<>();
  private final ReentrantLock subscriptionLock = new ReentrantLock();
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  private final AtomicLong sent = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private final AtomicLong expired = new AtomicLong();
  private final AtomicInteger consecutiveFailures = new AtomicInteger();
  private volatile boolean healthy = true;

  public ResilientMessageBus(
      LowLatencyTransport lowLatency,
      DurableTransport durable,
      CircuitBreakerRegistry breakers,
      EnvelopeCodec codec,
      LogicExecutor executor,
      MessageBusProperties properties,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry,
      ThreadPoolTaskScheduler retryTaskScheduler,
      AsyncTaskExecutor receiveExecutor,
      Clock clock) {
    this.lowLatency = lowLatency;
    this.durable = durable;
    this.breakers = breakers;
    this.codec = codec;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
    this.queueNames = new QueueNames(properties.getQueuePrefix());
    this.backoff = new BackoffPolicy(properties);
    this.sendRetry = retryRegistry.retry(SEND_RETRY_NAME, sendRetryConfig());
    this.retryScheduler = new RetryScheduler(retryTaskScheduler);
    this.receiveExecutor = receiveExecutor;
    this.sendRetry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "[MessageBus] send retry: attempt={}, wait={}ms, cause={}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    ExceptionUtils.describe(event.getLastThrowable())));
    registerMeters(meterRegistry);
  }

  // ==================== send ====================

  @Override
  public String send(AgentMessage message, MessagePriority priority, Duration ttl) {
    checkRunning();
    MessageEnvelope envelope =
        MessageEnvelope.wrap(message, priority, ttl, properties.getMaxRetries(), clock.instant());
    TaskContext context = TaskContext.of(COMPONENT, "Send", envelope.recipientAgent());

    executor.executeOrCatch(
        () -> {
          enqueue(envelope);
          return null;
        },
        e -> {
          throw onSendFailure(envelope, e);
        },
        context);

    sent.incrementAndGet();
    consecutiveFailures.set(0);
    healthy = true;
    log.debug(
        "[MessageBus] sent: id={}, recipient={}, priority={}",
        envelope.messageId(),
        envelope.recipientAgent(),
        priority);
    return envelope.messageId();
  }

  @Override
  public String sendWithResilience(
      AgentMessage message, String recipient, MessagePriority priority, Duration ttl) {
    AgentMessage addressed = message.withRecipient(recipient);
    return executor.executeOrCatch(
        () -> sendRetry.executeSupplier(() -> send(addressed, priority, ttl)),
        e -> {
          String reason = ExceptionUtils.describe(e);
          deadLetter(addressed, recipient, reason);
          throw new MessageBusException(properties.getSendAttempts(), recipient, e);
        },
        TaskContext.of(COMPONENT, "SendWithResilience", recipient));
  }

  @Override
  public void deadLetter(AgentMessage message, String recipient, String reason) {
    MessageEnvelope envelope =
        MessageEnvelope.wrap(
            message.withRecipient(recipient),
            MessagePriority.LOW,
            properties.getDeadLetterRetention(),
            properties.getMaxRetries(),
            clock.instant());
    writeDeadLetter(envelope, reason);
  }

  /** Low-latency first, durable on any failure. Throws the durable failure. */
  private void enqueue(MessageEnvelope envelope) throws Exception {
    String body = executor.executeWithTranslation(
        () -> codec.encode(envelope),
        ExceptionTranslator.forJson(),
        TaskContext.of(COMPONENT, "Encode", envelope.messageId()));

    Throwable lowLatencyFailure =
        executor.executeWithFallback(
            () -> {
              pushLowLatency(envelope, body);
              return null;
            },
            e -> e,
            TaskContext.of(COMPONENT, "LowLatencySend", envelope.recipientAgent()));
    if (lowLatencyFailure == null) {
      return;
    }

    log.warn(
        "[MessageBus] low-latency send failed, falling back to durable: id={}, cause={}",
        envelope.messageId(),
        ExceptionUtils.describe(lowLatencyFailure));
    try {
      pushDurable(envelope, body);
    } catch (Exception durableFailure) {
      durableFailure.addSuppressed(lowLatencyFailure);
      throw durableFailure;
    }
  }

  private void pushLowLatency(MessageEnvelope envelope, String body) throws Exception {
    String queue = queueNames.queue(envelope.recipientAgent());
    Duration ttl = atLeast(envelope.remainingTtl(clock.instant()), MIN_QUEUE_TTL);
    breaker(LOW_LATENCY_BREAKER)
        .call(
            () -> {
              if (envelope.priority().isUrgent()) {
                lowLatency.pushHead(queue, body, ttl);
              } else {
                lowLatency.pushTail(queue, body, ttl);
              }
              return null;
            });
  }

  private void pushDurable(MessageEnvelope envelope, String body) throws Exception {
    String queue = queueNames.queue(envelope.recipientAgent());
    breaker(DURABLE_BREAKER)
        .call(
            () -> {
              String url = durable.ensureQueue(queue);
              durable.send(url, body, attributes(envelope));
              return null;
            });
  }

  private RuntimeException onSendFailure(MessageEnvelope envelope, Throwable cause) {
    failed.incrementAndGet();
    int streak = consecutiveFailures.incrementAndGet();
    if (streak >= properties.getUnhealthyThreshold() && healthy) {
      healthy = false;
      log.error("[MessageBus] marked unhealthy: consecutiveFailures={}", streak);
    }
    return new MessageDeliveryException(envelope.recipientAgent(), cause);
  }

  // ==================== subscribe ====================

  /**
   * Registers the handler and starts the agent's receive loop. An existing loop for the agent is
   * stopped first, so at most one loop polls an agent's queues.
   */
  @Override
  public void subscribe(String agentName, MessageHandler handler) {
    checkRunning();
    subscriptionLock.lock();
    try {
      Subscription previous = subscribers.remove(agentName);
      if (previous != null) {
        previous.cancel();
        awaitStopped(agentName, previous, properties.getShutdownTimeout());
      }
      handlers.put(agentName, handler);
      Subscription subscription = new Subscription();
      try {
        subscription.loop = receiveExecutor.submit(() -> receiveLoop(agentName, subscription));
      } catch (RuntimeException e) {
        handlers.remove(agentName);
        throw e;
      }
      subscribers.put(agentName, subscription);
    } finally {
      subscriptionLock.unlock();
    }
    log.info("[MessageBus] subscribed: agent={}", agentName);
  }

  @Override
  public void unsubscribe(String agentName) {
    subscriptionLock.lock();
    try {
      Subscription subscription = subscribers.remove(agentName);
      if (subscription != null) {
        subscription.cancel();
        awaitStopped(agentName, subscription, properties.getShutdownTimeout());
      }
      handlers.remove(agentName);
    } finally {
      subscriptionLock.unlock();
    }
    log.info("[MessageBus] unsubscribed: agent={}", agentName);
  }

  /**
   * Detaches the agent's handler while its receive loop keeps draining the queue; drained
   * messages are dead-lettered with {@value #NO_HANDLER}.
   */
  public void removeHandler(String agentName) {
    handlers.remove(agentName);
    log.info("[MessageBus] handler removed, queue draining to DLQ: agent={}", agentName);
  }

  private void receiveLoop(String agentName, Subscription subscription) {
    if (!subscription.started.compareAndSet(false, true)) {
      return;
    }
    try {
      pollUntilStopped(agentName, subscription);
    } finally {
      subscription.stopped.countDown();
    }
  }

  private void pollUntilStopped(String agentName, Subscription subscription) {
    log.info("[MessageBus] receive loop started: agent={}", agentName);
    TaskContext context = TaskContext.of(COMPONENT, "Poll", agentName);
    int failures = 0;

    while (!shutdown.get() && !subscription.cancelled && !Thread.currentThread().isInterrupted()) {
      PollOutcome outcome =
          executor.executeOrDefault(() -> pollOnce(agentName), PollOutcome.FAILED, context);

      Duration pause;
      if (outcome == PollOutcome.FAILED) {
        failures++;
        pause = backoff.subscriberBackoff(failures);
        log.warn(
            "[MessageBus] receive failed: agent={}, failures={}, backoff={}ms",
            agentName,
            failures,
            pause.toMillis());
      } else {
        failures = 0;
        pause = outcome == PollOutcome.EMPTY ? properties.getIdlePoll() : Duration.ZERO;
      }
      if (!pause.isZero() && !sleep(pause)) {
        break;
      }
    }
    log.info("[MessageBus] receive loop stopped: agent={}, shutdown={}", agentName, shutdown.get());
  }

  private PollOutcome pollOnce(String agentName) throws Exception {
    String queue = queueNames.queue(agentName);

    String body =
        executor.executeOrDefault(
            () -> breaker(LOW_LATENCY_BREAKER).call(() -> lowLatency.popHead(queue)),
            null,
            TaskContext.of(COMPONENT, "LowLatencyReceive", agentName));

    if (body == null) {
      body = receiveDurable(queue);
    }
    if (body == null) {
      return PollOutcome.EMPTY;
    }
    process(agentName, body);
    return PollOutcome.PROCESSED;
  }

  private String receiveDurable(String queue) throws Exception {
    return breaker(DURABLE_BREAKER)
        .call(
            () -> {
              String url = durable.ensureQueue(queue);
              List<DurableMessage> messages =
                  durable.receive(url, 1, properties.getDurableWaitSeconds());
              if (messages.isEmpty()) {
                return null;
              }
              DurableMessage message = messages.get(0);
              durable.delete(url, message.receiptHandle());
              return message.body();
            });
  }

  private void process(String agentName, String body) {
    MessageEnvelope envelope =
        executor.executeOrCatch(
            () -> codec.decode(body),
            e -> {
              failed.incrementAndGet();
              log.error(
                  "[MessageBus] undecodable message dropped: agent={}, cause={}",
                  agentName,
                  ExceptionUtils.describe(e));
              return null;
            },
            TaskContext.of(COMPONENT, "Decode", agentName));
    if (envelope == null) {
      return;
    }

    if (envelope.isExpired(clock.instant())) {
      expired.incrementAndGet();
      log.debug(
          "[MessageBus] expired message discarded: id={}, expiresAt={}",
          envelope.messageId(),
          envelope.expiresAt());
      return;
    }

    MessageHandler handler = handlers.get(agentName);
    if (handler == null) {
      log.warn("[MessageBus] no handler: agent={}, id={}", agentName, envelope.messageId());
      writeDeadLetter(envelope, NO_HANDLER);
      return;
    }

    executor.executeOrCatch(
        () -> {
          handler.handle(envelope);
          delivered.incrementAndGet();
          return null;
        },
        e -> {
          onHandlerFailure(envelope, e);
          return null;
        },
        TaskContext.of(COMPONENT, "Dispatch", agentName));
  }

  private void onHandlerFailure(MessageEnvelope envelope, Throwable error) {
    String cause = ExceptionUtils.describe(error);
    if (!envelope.shouldRetry(clock.instant())) {
      writeDeadLetter(envelope, "Max retries exceeded: " + cause);
      return;
    }
    if (shutdown.get()) {
      log.debug("[MessageBus] retry skipped, shutting down: id={}", envelope.messageId());
      return;
    }

    MessageEnvelope next = envelope.withIncrementedRetry();
    retried.incrementAndGet();
    Duration delay = backoff.handlerRetryDelay(next.retryCount());
    retryScheduler.schedule(() -> redeliver(next, delay), delay, next.messageId());
  }

  private void redeliver(MessageEnvelope envelope, Duration delay) {
    executor.executeOrCatch(
        () -> {
          enqueue(envelope);
          log.info(
              "[MessageBus] retrying message: id={}, attempt={}, delay={}ms",
              envelope.messageId(),
              envelope.retryCount(),
              delay.toMillis());
          return null;
        },
        e -> {
          writeDeadLetter(envelope, "Retry failed: " + ExceptionUtils.describe(e));
          return null;
        },
        TaskContext.of(COMPONENT, "Redeliver", envelope.messageId()));
  }

  // ==================== dead letter ====================

  /** Low-latency DLQ first, durable DLQ as fallback. Failure is logged, never thrown. */
  private void writeDeadLetter(MessageEnvelope envelope, String reason) {
    Instant now = clock.instant();
    MessageEnvelope annotated =
        envelope
            .withDeadLetterReason(reason, now)
            .withPriorityAndExpiry(
                MessagePriority.LOW, now.plus(properties.getDeadLetterRetention()));
    String dlq = queueNames.deadLetterQueue(envelope.recipientAgent());
    TaskContext context = TaskContext.of(COMPONENT, "DeadLetter", envelope.recipientAgent());

    boolean stored =
        executor.executeOrCatch(
            () -> {
              String body = codec.encode(annotated);
              boolean viaLowLatency =
                  executor.executeOrDefault(
                      () ->
                          breaker(LOW_LATENCY_BREAKER)
                              .call(
                                  () -> {
                                    lowLatency.pushHead(
                                        dlq, body, properties.getDeadLetterRetention());
                                    return true;
                                  }),
                      false,
                      TaskContext.of(COMPONENT, "LowLatencyDeadLetter", dlq));
              if (!viaLowLatency) {
                breaker(DURABLE_BREAKER)
                    .call(
                        () -> {
                          durable.send(durable.ensureQueue(dlq), body, attributes(annotated));
                          return true;
                        });
              }
              return true;
            },
            e -> {
              log.error(
                  "[MessageBus] dead-letter write failed: id={}, reason={}, cause={}",
                  envelope.messageId(),
                  reason,
                  ExceptionUtils.describe(e));
              return false;
            },
            context);

    if (stored) {
      deadLettered.incrementAndGet();
      log.warn(
          "[MessageBus] dead-lettered: id={}, recipient={}, reason={}",
          envelope.messageId(),
          envelope.recipientAgent(),
          reason);
    }
  }

  // ==================== stats / health / shutdown ====================

  @Override
  public MessageBusStats stats() {
    return new MessageBusStats(
        sent.get(),
        delivered.get(),
        failed.get(),
        retried.get(),
        deadLettered.get(),
        expired.get(),
        healthy,
        consecutiveFailures.get(),
        subscribers.size(),
        handlers.size(),
        retryScheduler.pendingCount(),
        clock.instant());
  }

  @Override
  public QueueStats queueStats(String agentName) {
    String queue = queueNames.queue(agentName);
    String dlq = queueNames.deadLetterQueue(agentName);

    long lowLatencyLength =
        executor.executeOrDefault(
            () -> lowLatency.length(queue), 0L, TaskContext.of(COMPONENT, "QueueLength", queue));
    long deadLetterLength =
        executor.executeOrDefault(
            () -> lowLatency.length(dlq), 0L, TaskContext.of(COMPONENT, "QueueLength", dlq));
    long durableLength =
        executor.executeOrDefault(
            () -> durable.approximateLength(durable.ensureQueue(queue)),
            0L,
            TaskContext.of(COMPONENT, "DurableQueueLength", queue));

    return new QueueStats(
        agentName, lowLatencyLength, durableLength, deadLetterLength, handlers.containsKey(agentName));
  }

  @Override
  public boolean healthCheck() {
    boolean lowLatencyUp =
        executor.executeOrDefault(
            lowLatency::ping, false, TaskContext.of(COMPONENT, "Ping", "low_latency"));
    boolean durableUp =
        executor.executeOrDefault(
            durable::ping, false, TaskContext.of(COMPONENT, "Ping", "durable"));
    healthy = !shutdown.get() && lowLatencyUp && durableUp;
    if (!healthy) {
      log.warn(
          "[MessageBus] health check failed: lowLatency={}, durable={}, shutdown={}",
          lowLatencyUp,
          durableUp,
          shutdown.get());
    }
    return healthy;
  }

  @Override
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    log.info(
        "[MessageBus] shutting down: subscribers={}, pendingRetries={}",
        subscribers.size(),
        retryScheduler.pendingCount());

    retryScheduler.cancelAll();
    subscriptionLock.lock();
    try {
      subscribers.values().forEach(Subscription::cancel);
      long deadline = System.nanoTime() + properties.getShutdownTimeout().toNanos();
      subscribers.forEach(
          (agent, subscription) ->
              awaitStopped(
                  agent,
                  subscription,
                  Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()))));
      subscribers.clear();
    } finally {
      subscriptionLock.unlock();
    }
    handlers.clear();

    executor.executeOrDefault(
        () -> {
          lowLatency.close();
          return null;
        },
        null,
        TaskContext.of(COMPONENT, "Close", "low_latency"));
    executor.executeOrDefault(
        () -> {
          durable.close();
          return null;
        },
        null,
        TaskContext.of(COMPONENT, "Close", "durable"));
    healthy = false;
    log.info("[MessageBus] shut down: stats={}", stats());
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  // ==================== helpers ====================

  private RetryConfig sendRetryConfig() {
    return RetryConfig.custom()
        .maxAttempts(properties.getSendAttempts())
        .intervalFunction(backoff.sendInterval())
        .retryExceptions(MessageDeliveryException.class)
        .build();
  }

  private void awaitStopped(String agentName, Subscription subscription, Duration timeout) {
    boolean stopped =
        executor.executeOrDefault(
            () -> subscription.awaitStopped(timeout),
            false,
            TaskContext.of(COMPONENT, "StopLoop", agentName));
    if (!stopped) {
      log.warn(
          "[MessageBus] receive loop did not stop within {}ms: agent={}",
          timeout.toMillis(),
          agentName);
    }
  }

  private CircuitBreaker breaker(String name) {
    return breakers.breaker(name);
  }

  private void checkRunning() {
    if (shutdown.get()) {
      throw new IllegalStateException("message bus is shut down");
    }
  }

  private boolean sleep(Duration pause) {
    try {
      Thread.sleep(pause.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static Map<String, String> attributes(MessageEnvelope envelope) {
    return Map.of(
        "priority", envelope.priority().value(),
        "message_type", String.valueOf(envelope.messageType()),
        "sender_agent", String.valueOf(envelope.senderAgent()));
  }

  private static Duration atLeast(Duration value, Duration minimum) {
    return value.compareTo(minimum) < 0 ? minimum : value;
  }

  private void registerMeters(MeterRegistry registry) {
    if (registry == null) {
      return;
    }
    counter(registry, "sent", sent);
    counter(registry, "delivered", delivered);
    counter(registry, "failed", failed);
    counter(registry, "retried", retried);
    counter(registry, "dead_lettered", deadLettered);
    counter(registry, "expired", expired);
    Gauge.builder("message.bus.subscribers", subscribers, Map::size).register(registry);
    Gauge.builder("message.bus.retries.pending", retryScheduler, RetryScheduler::pendingCount)
        .register(registry);
  }

  private static void counter(MeterRegistry registry, String result, AtomicLong source) {
    FunctionCounter.builder("message.bus.messages", source, AtomicLong::get)
        .tag("result", result)
        .register(registry);
  }

  /** One agent's receive loop. A loop cancelled before it started never runs. */
  private static final class Subscription {
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean cancelled;
    private volatile Future<?> loop;

    private void cancel() {
      cancelled = true;
      Future<?> f = loop;
      if (f != null) {
        f.cancel(true);
      }
    }

    private boolean awaitStopped(Duration timeout) throws InterruptedException {
      if (started.compareAndSet(false, true)) {
        return true;
      }
      return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
  }

  private enum PollOutcome {
    PROCESSED,
    EMPTY,
    FAILED
  }
}
