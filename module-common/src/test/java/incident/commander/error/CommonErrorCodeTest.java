package incident.commander.error;

import static org.assertj.core.api.Assertions.assertThat;

import incident.commander.error.exception.CircuitBreakerOpenException;
import incident.commander.error.exception.MessageBusException;
import incident.commander.error.exception.StageExecutionException;
import incident.commander.error.exception.marker.CircuitBreakerIgnoreMarker;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class CommonErrorCodeTest {

  @Test
  @DisplayName("every error code is unique")
  void codesAreUnique() {
    Set<String> codes =
        Arrays.stream(CommonErrorCode.values())
            .map(CommonErrorCode::getCode)
            .collect(Collectors.toSet());

    assertThat(codes).hasSize(CommonErrorCode.values().length);
  }

  @Test
  @DisplayName("breaker-open is a distinct kind carrying the dependency name")
  void circuitBreakerOpenCarriesDependency() {
    CircuitBreakerOpenException e = new CircuitBreakerOpenException("durable_transport");

    assertThat(e.getDependency()).isEqualTo("durable_transport");
    assertThat(e.getMessage()).contains("durable_transport");
    assertThat(e.getErrorCode().getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(e).isInstanceOf(CircuitBreakerIgnoreMarker.class);
  }

  @Test
  @DisplayName("message args are formatted into the template")
  void formatsArguments() {
    MessageBusException e =
        new MessageBusException(4, "diagnosis", new IllegalStateException("down"));

    assertThat(e.getMessage()).contains("4").contains("diagnosis");
    assertThat(e.getCause()).hasMessage("down");
  }

  @Test
  @DisplayName("stage failure falls back to the cause's type name when it has no message")
  void stageFailureDescribesCause() {
    StageExecutionException e = new StageExecutionException("analysis", new RuntimeException());

    assertThat(e.getStage()).isEqualTo("analysis");
    assertThat(e.getMessage()).contains("RuntimeException");
  }
}
