package incident.commander.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "Invalid input value: %s", HttpStatus.BAD_REQUEST),
  INVALID_INCIDENT("C002", "Invalid incident (%s)", HttpStatus.BAD_REQUEST),
  UNKNOWN_AGENT("C003", "Unknown agent (name: %s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "Internal server error.", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S002", "Data processing failed (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  STAGE_EXECUTION_FAILED("S003", "Stage failed (stage: %s, reason: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  GRAPH_DEFINITION_INVALID("S004", "Invalid graph definition: %s", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Messaging (5xx) ===
  MESSAGE_DELIVERY_FAILED(
      "M001", "Message delivery failed on every transport (recipient: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  MESSAGE_BUS_FAILURE(
      "M002", "Message could not be sent after %s attempts (recipient: %s)", HttpStatus.SERVICE_UNAVAILABLE),

  // === Resilience (5xx) ===
  CIRCUIT_BREAKER_OPEN("R001", "Circuit breaker is open (dependency: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  DEPENDENCY_TIMEOUT(
      "R002", "Dependency call timed out (dependency: %s, timeout: %sms)", HttpStatus.GATEWAY_TIMEOUT);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
