package incident.commander.error.exception.marker;

/**
 * Exceptions carrying this marker are caller errors: they are rethrown without being counted
 * against the dependency's circuit breaker.
 */
public interface CircuitBreakerIgnoreMarker {}
