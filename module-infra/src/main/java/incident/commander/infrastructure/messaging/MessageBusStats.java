package incident.commander.infrastructure.messaging;

import java.time.Instant;

public record MessageBusStats(
    long sent,
    long delivered,
    long failed,
    long retried,
    long deadLettered,
    long expired,
    boolean healthy,
    int consecutiveFailures,
    int activeSubscribers,
    int registeredHandlers,
    int pendingRetries,
    Instant timestamp) {}
