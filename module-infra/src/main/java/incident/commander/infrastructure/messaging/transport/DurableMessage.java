package incident.commander.infrastructure.messaging.transport;

/**
 * A message read from the durable transport.
 *
 * @param body message body
 * @param receiptHandle handle used to delete the message after processing
 */
public record DurableMessage(String body, String receiptHandle) {}
