package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;
import incident.commander.error.exception.marker.CircuitBreakerRecordMarker;

/**
 * Both the low-latency and the durable transport refused a message.
 *
 * <p>The cause is the durable transport's failure; the low-latency failure is attached as a
 * suppressed exception.
 */
public class MessageDeliveryException extends ServerBaseException
    implements CircuitBreakerRecordMarker {

  public MessageDeliveryException(String recipient, Throwable cause) {
    super(CommonErrorCode.MESSAGE_DELIVERY_FAILED, cause, recipient);
  }
}
