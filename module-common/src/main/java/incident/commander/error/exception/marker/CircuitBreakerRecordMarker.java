package incident.commander.error.exception.marker;

/** Exceptions carrying this marker count as failures for the dependency's circuit breaker. */
public interface CircuitBreakerRecordMarker {}
