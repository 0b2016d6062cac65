package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;
import incident.commander.error.exception.marker.CircuitBreakerRecordMarker;

/** Fallback translation target for checked exceptions with no domain-specific mapping. */
public class InternalSystemException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.DATA_PROCESSING_ERROR, cause, taskName);
  }
}
