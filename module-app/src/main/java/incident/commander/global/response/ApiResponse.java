package incident.commander.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Common response envelope.
 *
 * @param success whether the call succeeded
 * @param data payload on success
 * @param error error details on failure
 * @param <T> payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorInfo error) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data, null);
  }

  public static <T> ApiResponse<T> error(String code, String message) {
    return new ApiResponse<>(false, null, new ErrorInfo(code, message));
  }

  public record ErrorInfo(String code, String message) {}
}
