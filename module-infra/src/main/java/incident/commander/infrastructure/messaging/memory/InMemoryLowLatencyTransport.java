package incident.commander.infrastructure.messaging.memory;

import incident.commander.infrastructure.messaging.transport.LowLatencyTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process stand-in for the Redis transport.
 *
 * <p>Mirrors Redis list semantics: the TTL applies to the whole queue and is refreshed on every
 * push; an expired queue is dropped on next access. {@link #setAvailable(boolean)} simulates an
 * outage.
 */
@Slf4j
public class InMemoryLowLatencyTransport implements LowLatencyTransport {

  private final Map<String, TimedQueue> queues = new ConcurrentHashMap<>();
  private final Clock clock;
  private volatile boolean available = true;

  public InMemoryLowLatencyTransport() {
    this(Clock.systemUTC());
  }

  public InMemoryLowLatencyTransport(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void pushHead(String queue, String body, Duration ttl) {
    TimedQueue q = live(queue);
    q.items.addFirst(body);
    q.expiresAt = clock.instant().plus(ttl);
  }

  @Override
  public void pushTail(String queue, String body, Duration ttl) {
    TimedQueue q = live(queue);
    q.items.addLast(body);
    q.expiresAt = clock.instant().plus(ttl);
  }

  @Override
  public String popHead(String queue) {
    return live(queue).items.pollFirst();
  }

  @Override
  public long length(String queue) {
    return live(queue).items.size();
  }

  @Override
  public boolean ping() {
    return available;
  }

  @Override
  public void close() {
    log.debug("[InMemoryLowLatency] closed: queues={}", queues.size());
  }

  public void setAvailable(boolean available) {
    this.available = available;
  }

  private TimedQueue live(String queue) {
    if (!available) {
      throw new IllegalStateException("low-latency transport unavailable");
    }
    Instant now = clock.instant();
    return queues.compute(
        queue,
        (name, existing) ->
            (existing == null || existing.isExpired(now)) ? new TimedQueue() : existing);
  }

  private static final class TimedQueue {
    private final LinkedBlockingDeque<String> items = new LinkedBlockingDeque<>();
    private volatile Instant expiresAt = Instant.MAX;

    private boolean isExpired(Instant now) {
      return now.isAfter(expiresAt);
    }
  }
}
