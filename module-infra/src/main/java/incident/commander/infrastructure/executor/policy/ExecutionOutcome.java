package incident.commander.infrastructure.executor.policy;

public enum ExecutionOutcome {
  SUCCESS,
  FAILURE
}
