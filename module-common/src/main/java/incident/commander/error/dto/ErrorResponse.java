package incident.commander.error.dto;

import incident.commander.error.ErrorCode;
import incident.commander.error.exception.base.BaseException;
import java.time.LocalDateTime;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  /** Built from a domain exception; keeps the formatted message (which agent, which stage). */
  public static ErrorResponse from(BaseException e) {
    return new ErrorResponse(
        e.getErrorCode().getStatusCode(),
        e.getErrorCode().getCode(),
        e.getMessage(),
        LocalDateTime.now());
  }

  /** Built from the code alone; the static message hides internal detail. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return new ErrorResponse(
        errorCode.getStatusCode(), errorCode.getCode(), errorCode.getMessage(), LocalDateTime.now());
  }
}
