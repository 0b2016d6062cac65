package incident.commander.orchestration.state;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the incident timeline.
 *
 * @param phase pipeline phase ({@code detection}, {@code consensus}, {@code error}, ...)
 * @param agent agent or component that produced the event
 * @param message human-readable summary
 * @param metadata structured detail (immutable)
 * @param timestamp when the event was recorded
 */
public record TimelineEvent(
    String phase, String agent, String message, Map<String, Object> metadata, Instant timestamp) {

  public static final String ERROR_PHASE = "error";

  public TimelineEvent {
    Objects.requireNonNull(phase, "phase");
    Objects.requireNonNull(timestamp, "timestamp");
    agent = agent == null ? phase : agent;
    message = message == null ? "" : message;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static TimelineEvent of(
      String phase, String agent, String message, Map<String, Object> metadata, Instant at) {
    return new TimelineEvent(phase, agent, message, metadata, at);
  }
}
