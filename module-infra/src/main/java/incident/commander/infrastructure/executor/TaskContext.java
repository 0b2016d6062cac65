package incident.commander.infrastructure.executor;

import java.util.Objects;

/**
 * Structured task name for executor logging and metrics.
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * TaskContext.of("MessageBus", "Send", "diagnosis") -> "MessageBus:Send:diagnosis"
 * TaskContext.of("StateGraph", "Run")               -> "StateGraph:Run"
 * </pre>
 *
 * <p>component and operation are fixed taxonomy values and may be used as metric tags;
 * dynamicValue is only written to logs.
 *
 * @param component component name (e.g. "MessageBus", "CircuitBreaker")
 * @param operation operation name (e.g. "Send", "Dispatch")
 * @param dynamicValue per-call value (agent name, message id)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
