package incident.commander.infrastructure.executor.policy;

final class TaskLogTags {

  static final String TAG_START = "[Task:START]";
  static final String TAG_SUCCESS = "[Task:SUCCESS]";
  static final String TAG_SLOW = "[Task:SLOW]";
  static final String TAG_FAILURE = "[Task:FAILURE]";
  static final String TAG_AFTER = "[Task:AFTER]";

  private TaskLogTags() {}
}
