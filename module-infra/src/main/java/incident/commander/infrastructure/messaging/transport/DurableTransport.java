package incident.commander.infrastructure.messaging.transport;

import java.util.List;
import java.util.Map;

/**
 * Durable queue with at-least-once delivery (SQS in production).
 *
 * <p>Queues are addressed by URL. {@link #ensureQueue(String)} resolves a name to its URL and
 * provisions the queue (with a dead-letter queue and redrive policy) when it does not exist.
 */
public interface DurableTransport extends AutoCloseable {

  String ensureQueue(String queueName) throws Exception;

  void send(String queueUrl, String body, Map<String, String> attributes) throws Exception;

  /** Long-polls up to {@code waitSeconds} for at most {@code maxMessages} messages. */
  List<DurableMessage> receive(String queueUrl, int maxMessages, int waitSeconds)
      throws Exception;

  void delete(String queueUrl, String receiptHandle) throws Exception;

  long approximateLength(String queueUrl) throws Exception;

  /** Connectivity check. */
  boolean ping();

  @Override
  void close();
}
