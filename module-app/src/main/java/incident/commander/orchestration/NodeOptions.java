package incident.commander.orchestration;

/**
 * Per-node execution options.
 *
 * @param isRequired a failure stops the run; otherwise it is recorded and the walk continues
 */
public record NodeOptions(boolean isRequired) {

  private static final NodeOptions REQUIRED = new NodeOptions(true);
  private static final NodeOptions BEST_EFFORT = new NodeOptions(false);

  public static NodeOptions required() {
    return REQUIRED;
  }

  public static NodeOptions bestEffort() {
    return BEST_EFFORT;
  }
}
