package incident.commander.infrastructure.messaging.transport;

import java.time.Duration;

/**
 * Fast, non-durable list-style queue (Redis in production).
 *
 * <p>Implementations throw on connectivity failures; the bus decides what to do about them.
 */
public interface LowLatencyTransport extends AutoCloseable {

  /** Inserts at the head and sets the whole queue's TTL. */
  void pushHead(String queue, String body, Duration ttl) throws Exception;

  /** Appends at the tail and sets the whole queue's TTL. */
  void pushTail(String queue, String body, Duration ttl) throws Exception;

  /** Removes and returns the head element, or {@code null} when the queue is empty. */
  String popHead(String queue) throws Exception;

  long length(String queue) throws Exception;

  /** Connectivity check. */
  boolean ping();

  @Override
  void close();
}
