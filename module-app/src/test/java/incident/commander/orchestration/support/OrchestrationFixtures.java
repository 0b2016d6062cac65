package incident.commander.orchestration.support;

import incident.commander.core.domain.model.agent.ActionType;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.domain.model.agent.Recommendation;
import incident.commander.core.domain.model.agent.RiskLevel;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.port.out.IncidentAgent;
import incident.commander.infrastructure.executor.DefaultLogicExecutor;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.executor.policy.ExecutionPipeline;
import incident.commander.infrastructure.executor.policy.LoggingPolicy;
import incident.commander.infrastructure.executor.strategy.ExceptionTranslator;
import incident.commander.infrastructure.resilience.CircuitBreakerProperties;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import incident.commander.orchestration.stage.StageSupport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.BiFunction;

/** Shared builders for orchestration tests. */
public final class OrchestrationFixtures {

  public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

  private OrchestrationFixtures() {}

  public static LogicExecutor logicExecutor() {
    return new DefaultLogicExecutor(
        new ExecutionPipeline(List.of(new LoggingPolicy(1_000))),
        ExceptionTranslator.defaultTranslator());
  }

  public static CircuitBreakerRegistry breakers() {
    return new CircuitBreakerRegistry(new CircuitBreakerProperties(), CLOCK, null);
  }

  public static StageSupport support(ExecutorService agentPool) {
    return support(breakers(), agentPool, Duration.ofSeconds(5));
  }

  public static StageSupport support(
      CircuitBreakerRegistry breakers, ExecutorService agentPool, Duration stageTimeout) {
    return new StageSupport(logicExecutor(), breakers, agentPool, stageTimeout, CLOCK);
  }

  public static Incident incident(String title, IncidentSeverity severity) {
    return Incident.create(title, "", severity);
  }

  public static Recommendation recommendation(
      AgentType type, Incident incident, String actionId, ActionType action, double confidence) {
    return Recommendation.builder(type, incident.id())
        .actionId(actionId)
        .actionType(action)
        .confidence(confidence)
        .riskLevel(RiskLevel.MEDIUM)
        .build();
  }

  /** Agent backed by a lambda. */
  public static IncidentAgent agent(
      AgentType type, BiFunction<Incident, Map<String, Object>, List<Recommendation>> behaviour) {
    return new IncidentAgent() {
      @Override
      public AgentType type() {
        return type;
      }

      @Override
      public List<Recommendation> processIncident(Incident incident, Map<String, Object> context) {
        return behaviour.apply(incident, context);
      }
    };
  }

  public static IncidentAgent failingAgent(AgentType type, String message) {
    return agent(
        type,
        (incident, context) -> {
          throw new IllegalStateException(message);
        });
  }
}
