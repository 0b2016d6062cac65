package incident.commander.infrastructure.messaging;

import java.time.Duration;

/** Agent-to-agent messaging with delivery guarantees described on {@link ResilientMessageBus}. */
public interface MessageBus extends AutoCloseable {

  /**
   * Sends once: low-latency transport first, durable transport on any failure.
   *
   * @return the new envelope's message id
   * @throws incident.commander.error.exception.MessageDeliveryException when both transports fail
   */
  String send(AgentMessage message, MessagePriority priority, Duration ttl);

  /**
   * Sends with retries and backoff; dead-letters the message when every attempt fails.
   *
   * @throws incident.commander.error.exception.MessageBusException after the last attempt
   */
  String sendWithResilience(
      AgentMessage message, String recipient, MessagePriority priority, Duration ttl);

  void subscribe(String agentName, MessageHandler handler);

  void unsubscribe(String agentName);

  /** Writes the message straight to the recipient's dead-letter queue. Never throws. */
  void deadLetter(AgentMessage message, String recipient, String reason);

  MessageBusStats stats();

  QueueStats queueStats(String agentName);

  boolean healthCheck();

  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
