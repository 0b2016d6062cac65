package incident.commander.orchestration.state;

/** Reserved state keys and the context keys shared between stages. */
public final class StateKeys {

  public static final String CONTEXT = "context";
  public static final String TIMELINE = "timeline";

  public static final String CONSENSUS_DECISION = "consensus_decision";
  public static final String RESOLUTION_RECOMMENDATION = "resolution_recommendation";

  public static final String TELEMETRY_SOURCES = "telemetry_sources";
  public static final String ALERT_COUNT = "alert_count";
  public static final String LOG_SOURCES = "log_sources";

  public static final String DETECTION_CONFIDENCE = "detection_confidence";
  public static final String DETECTION_ACTION_ID = "detection_action_id";
  public static final String DIAGNOSIS_CONFIDENCE = "diagnosis_confidence";
  public static final String DIAGNOSIS_ACTION = "diagnosis_action";
  public static final String PREDICTED_MINUTES = "predicted_minutes";
  public static final String PREDICTED_COST = "predicted_cost";
  public static final String CONSENSUS_ACTION = "consensus_action";
  public static final String CONSENSUS_CONFIDENCE = "consensus_confidence";
  public static final String RESOLUTION_ACTION = "resolution_action";
  public static final String RESOLUTION_READY = "resolution_ready";
  public static final String COMMUNICATION_SUMMARY = "communication_summary";
  public static final String COMMUNICATION_CHANNELS = "communication_channels";

  private StateKeys() {}

  /** {@code <phase>_completed_at}. */
  public static String completedAt(String phase) {
    return phase + "_completed_at";
  }

  /** {@code <node>_error}, written to values when a best-effort node fails. */
  public static String nodeError(String node) {
    return node + "_error";
  }

  public static boolean isReserved(String key) {
    return CONTEXT.equals(key) || TIMELINE.equals(key);
  }
}
