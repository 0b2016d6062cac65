package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;
import lombok.Getter;

/**
 * Raised when a call is rejected because the dependency's breaker is OPEN. The wrapped operation was
 * never invoked.
 *
 * <p>Callers can tell this apart from the operation's own failure and fall back immediately.
 */
@Getter
public class CircuitBreakerOpenException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String dependency;

  public CircuitBreakerOpenException(String dependency) {
    super(CommonErrorCode.CIRCUIT_BREAKER_OPEN, dependency);
    this.dependency = dependency;
  }
}
