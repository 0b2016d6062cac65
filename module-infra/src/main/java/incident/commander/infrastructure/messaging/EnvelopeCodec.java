package incident.commander.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/**
 * JSON codec for {@link MessageEnvelope}.
 *
 * <pre>
 * {"message_id": "...", "sender_agent": "detection", "recipient_agent": "communication",
 *  "message_type": "incident.detected", "payload": {...}, "priority": "high",
 *  "created_at": "2024-01-01T00:00:00Z", "expires_at": "...", "retry_count": 0,
 *  "max_retries": 3, "correlation_id": null}
 * </pre>
 *
 * <p>Unknown keys are ignored. Missing retry counters default to 0 and {@link
 * MessageEnvelope#DEFAULT_MAX_RETRIES}.
 */
@RequiredArgsConstructor
public class EnvelopeCodec {

  static final String MESSAGE_ID = "message_id";
  static final String SENDER_AGENT = "sender_agent";
  static final String RECIPIENT_AGENT = "recipient_agent";
  static final String MESSAGE_TYPE = "message_type";
  static final String PAYLOAD = "payload";
  static final String PRIORITY = "priority";
  static final String CREATED_AT = "created_at";
  static final String EXPIRES_AT = "expires_at";
  static final String RETRY_COUNT = "retry_count";
  static final String MAX_RETRIES = "max_retries";
  static final String CORRELATION_ID = "correlation_id";

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public Map<String, Object> toMap(MessageEnvelope envelope) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(MESSAGE_ID, envelope.messageId());
    map.put(SENDER_AGENT, envelope.senderAgent());
    map.put(RECIPIENT_AGENT, envelope.recipientAgent());
    map.put(MESSAGE_TYPE, envelope.messageType());
    map.put(PAYLOAD, envelope.payload());
    map.put(PRIORITY, envelope.priority().value());
    map.put(CREATED_AT, envelope.createdAt().toString());
    map.put(EXPIRES_AT, envelope.expiresAt().toString());
    map.put(RETRY_COUNT, envelope.retryCount());
    map.put(MAX_RETRIES, envelope.maxRetries());
    map.put(CORRELATION_ID, envelope.correlationId());
    return map;
  }

  @SuppressWarnings("unchecked")
  public MessageEnvelope fromMap(Map<String, Object> map) {
    Object payload = map.get(PAYLOAD);
    return new MessageEnvelope(
        (String) map.get(MESSAGE_ID),
        (String) map.get(SENDER_AGENT),
        (String) map.get(RECIPIENT_AGENT),
        (String) map.get(MESSAGE_TYPE),
        payload instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of(),
        MessagePriority.fromValue((String) map.get(PRIORITY)),
        Instant.parse((String) map.get(CREATED_AT)),
        Instant.parse((String) map.get(EXPIRES_AT)),
        intOrDefault(map.get(RETRY_COUNT), 0),
        intOrDefault(map.get(MAX_RETRIES), MessageEnvelope.DEFAULT_MAX_RETRIES),
        (String) map.get(CORRELATION_ID));
  }

  public String encode(MessageEnvelope envelope) throws JsonProcessingException {
    return objectMapper.writeValueAsString(toMap(envelope));
  }

  public MessageEnvelope decode(String json) throws JsonProcessingException {
    return fromMap(objectMapper.readValue(json, MAP_TYPE));
  }

  private static int intOrDefault(Object value, int defaultValue) {
    return value instanceof Number n ? n.intValue() : defaultValue;
  }
}
