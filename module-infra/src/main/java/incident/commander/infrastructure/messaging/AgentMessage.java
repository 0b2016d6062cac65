package incident.commander.infrastructure.messaging;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a caller asks the bus to deliver. The bus wraps it in a {@link MessageEnvelope}.
 *
 * @param senderAgent sending agent name
 * @param recipientAgent receiving agent name (selects the queue)
 * @param messageType application-level type, e.g. {@code incident.detected}
 * @param payload message body
 * @param correlationId optional id tying related messages together
 */
public record AgentMessage(
    String senderAgent,
    String recipientAgent,
    String messageType,
    Map<String, Object> payload,
    String correlationId) {

  public AgentMessage {
    if (senderAgent == null || senderAgent.isBlank()) {
      throw new IllegalArgumentException("senderAgent cannot be null or blank");
    }
    if (recipientAgent == null || recipientAgent.isBlank()) {
      throw new IllegalArgumentException("recipientAgent cannot be null or blank");
    }
    if (messageType == null || messageType.isBlank()) {
      throw new IllegalArgumentException("messageType cannot be null or blank");
    }
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public static AgentMessage of(
      String senderAgent, String recipientAgent, String messageType, Map<String, Object> payload) {
    return new AgentMessage(senderAgent, recipientAgent, messageType, payload, null);
  }

  public AgentMessage withRecipient(String recipient) {
    return new AgentMessage(senderAgent, recipient, messageType, payload, correlationId);
  }
}
