package incident.commander.infrastructure.messaging;

/**
 * Queue depths for one agent. A transport that cannot be queried reports 0.
 *
 * @param agentName agent the queues belong to
 * @param lowLatencyLength messages waiting on the low-latency transport
 * @param durableLength approximate messages waiting on the durable transport
 * @param deadLetterLength dead-lettered messages on the low-latency transport
 * @param subscribed whether a handler is registered
 */
public record QueueStats(
    String agentName,
    long lowLatencyLength,
    long durableLength,
    long deadLetterLength,
    boolean subscribed) {}
