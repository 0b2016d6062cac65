package incident.commander.error.exception;

import incident.commander.error.CommonErrorCode;
import incident.commander.error.exception.base.ServerBaseException;
import lombok.Getter;

@Getter
public class StageExecutionException extends ServerBaseException {

  private final String stage;

  public StageExecutionException(String stage, String reason) {
    super(CommonErrorCode.STAGE_EXECUTION_FAILED, stage, reason);
    this.stage = stage;
  }

  public StageExecutionException(String stage, Throwable cause) {
    super(CommonErrorCode.STAGE_EXECUTION_FAILED, cause, stage, describe(cause));
    this.stage = stage;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown";
    }
    String message = cause.getMessage();
    return message != null ? message : cause.getClass().getSimpleName();
  }
}
