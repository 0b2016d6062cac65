package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;
import incident.commander.error.exception.marker.CircuitBreakerRecordMarker;

/** A dependency did not answer within its call timeout. Counted as a breaker failure. */
public class DependencyTimeoutException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  public DependencyTimeoutException(String dependency, long timeoutMillis, Throwable cause) {
    super(CommonErrorCode.DEPENDENCY_TIMEOUT, cause, dependency, timeoutMillis);
  }
}
