package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;

/** Resilient send gave up after every attempt. The message has already been dead-lettered. */
public class MessageBusException extends ServerBaseException {

  public MessageBusException(int attempts, String recipient, Throwable cause) {
    super(CommonErrorCode.MESSAGE_BUS_FAILURE, cause, attempts, recipient);
  }
}
