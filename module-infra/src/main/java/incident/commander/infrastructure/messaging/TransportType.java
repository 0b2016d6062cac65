package incident.commander.infrastructure.messaging;

public enum TransportType {
  /** Redis (Redisson) low-latency transport with SQS durable fallback. */
  REDIS_SQS,
  /** In-process queues; local runs and tests. */
  IN_MEMORY
}
