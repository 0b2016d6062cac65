package incident.commander.error.exception.base;

import incident.commander.error.ErrorCode;

/**
 * ClientBaseException: 4xx errors caused by a request that does not match what the system accepts.
 * The message is returned to the caller as-is.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
