package incident.commander.infrastructure.messaging;

/**
 * Consumer callback for one agent's queue.
 *
 * <p>Throwing marks the delivery as failed: the envelope is retried with backoff while it has
 * retries and time left, then dead-lettered.
 */
@FunctionalInterface
public interface MessageHandler {

  void handle(MessageEnvelope envelope) throws Exception;
}
