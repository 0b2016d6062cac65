package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ClientBaseException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;

public class InvalidIncidentException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public InvalidIncidentException(String detail) {
    super(CommonErrorCode.INVALID_INCIDENT, detail);
  }
}
