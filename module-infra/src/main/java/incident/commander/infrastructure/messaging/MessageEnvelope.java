package incident.commander.infrastructure.messaging;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Transport envelope around an {@link AgentMessage}.
 *
 * <p>Immutable: retries and dead-lettering produce copies. {@link EnvelopeCodec} writes it as a
 * flat map with stable snake_case keys.
 */
public record MessageEnvelope(
    String messageId,
    String senderAgent,
    String recipientAgent,
    String messageType,
    Map<String, Object> payload,
    MessagePriority priority,
    Instant createdAt,
    Instant expiresAt,
    int retryCount,
    int maxRetries,
    String correlationId) {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final String DLQ_REASON = "dlq_reason";
  public static final String DLQ_TIMESTAMP = "dlq_timestamp";

  public MessageEnvelope {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(recipientAgent, "recipientAgent");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    priority = priority == null ? MessagePriority.MEDIUM : priority;
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    if (retryCount < 0 || maxRetries < 0) {
      throw new IllegalArgumentException("retry counters cannot be negative");
    }
  }

  /** Fresh envelope: new id, created now, expiring after {@code ttl}, no retries yet. */
  public static MessageEnvelope wrap(
      AgentMessage message, MessagePriority priority, Duration ttl, int maxRetries, Instant now) {
    return new MessageEnvelope(
        UUID.randomUUID().toString(),
        message.senderAgent(),
        message.recipientAgent(),
        message.messageType(),
        message.payload(),
        priority,
        now,
        now.plus(ttl),
        0,
        maxRetries,
        message.correlationId());
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean shouldRetry(Instant now) {
    return retryCount < maxRetries && !isExpired(now);
  }

  /** Time left before expiry, never negative. */
  public Duration remainingTtl(Instant now) {
    Duration remaining = Duration.between(now, expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public MessageEnvelope withIncrementedRetry() {
    return new MessageEnvelope(
        messageId,
        senderAgent,
        recipientAgent,
        messageType,
        payload,
        priority,
        createdAt,
        expiresAt,
        retryCount + 1,
        maxRetries,
        correlationId);
  }

  /** Copy whose payload records why and when the message was dead-lettered. */
  public MessageEnvelope withDeadLetterReason(String reason, Instant at) {
    Map<String, Object> annotated = new LinkedHashMap<>(payload);
    annotated.put(DLQ_REASON, reason == null ? "unknown" : reason);
    annotated.put(DLQ_TIMESTAMP, at.toString());
    return new MessageEnvelope(
        messageId,
        senderAgent,
        recipientAgent,
        messageType,
        annotated,
        priority,
        createdAt,
        expiresAt,
        retryCount,
        maxRetries,
        correlationId);
  }

  /** Copy with a new priority and expiry; used for dead-letter copies. */
  public MessageEnvelope withPriorityAndExpiry(MessagePriority newPriority, Instant newExpiry) {
    return new MessageEnvelope(
        messageId,
        senderAgent,
        recipientAgent,
        messageType,
        payload,
        newPriority,
        createdAt,
        newExpiry,
        retryCount,
        maxRetries,
        correlationId);
  }
}
