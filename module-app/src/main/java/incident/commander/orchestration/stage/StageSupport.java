package incident.commander.orchestration.stage;

import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Collaborators every stage needs.
 *
 * @param executor task runner with logging and exception translation
 * @param breakers per-agent circuit breakers
 * @param agentExecutor pool agent calls run on, so they can be timed out
 * @param stageTimeout limit for one agent call
 * @param clock time source for timeline events
 */
public record StageSupport(
    LogicExecutor executor,
    CircuitBreakerRegistry breakers,
    ExecutorService agentExecutor,
    Duration stageTimeout,
    Clock clock) {

  public StageSupport {
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(breakers, "breakers");
    Objects.requireNonNull(agentExecutor, "agentExecutor");
    Objects.requireNonNull(stageTimeout, "stageTimeout");
    Objects.requireNonNull(clock, "clock");
  }
}
