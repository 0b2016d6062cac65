package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ClientBaseException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;

public class UnknownAgentException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public UnknownAgentException(String agentName) {
    super(CommonErrorCode.UNKNOWN_AGENT, agentName);
  }
}
