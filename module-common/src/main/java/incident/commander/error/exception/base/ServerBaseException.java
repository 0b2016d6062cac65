package incident.commander.error.exception.base;

import incident.commander.error.ErrorCode;

/**
 * ServerBaseException: 5xx errors raised by infrastructure or internal faults. Mainly exists to
 * leave a detailed log trail for post-incident review.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
