package incident.commander.global.error;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.dto.ErrorResponse;
import incident.commander.error.exception.base.BaseException;
import java.time.LocalDateTime;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Domain exceptions keep their formatted message (which agent, which dependency). */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ResponseEntity.status(e.getErrorCode().getStatusCode()).body(ErrorResponse.from(e));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Validation failed: {}", detail);
    return badRequest(detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  protected ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
    return badRequest("malformed request body");
  }

  /** Anything else is a 500 with the static message only. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    CommonErrorCode code = CommonErrorCode.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(code.getStatusCode()).body(ErrorResponse.from(code));
  }

  private static ResponseEntity<ErrorResponse> badRequest(String detail) {
    CommonErrorCode code = CommonErrorCode.INVALID_INPUT_VALUE;
    return ResponseEntity.status(code.getStatusCode())
        .body(
            new ErrorResponse(
                code.getStatusCode(),
                code.getCode(),
                String.format(code.getMessage(), detail),
                LocalDateTime.now()));
  }
}
