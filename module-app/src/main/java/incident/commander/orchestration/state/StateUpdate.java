package incident.commander.orchestration.state;

import incident.commander.core.domain.model.consensus.ConsensusDecision;
import incident.commander.core.domain.model.incident.IncidentStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial state produced by one node.
 *
 * <p>{@code null} slots mean "unchanged". {@link #merge(StateUpdate, StateUpdate)} combines two
 * updates left to right with the same rules {@link GraphState#apply(StateUpdate)} uses.
 */
public final class StateUpdate {

  private static final StateUpdate EMPTY = builder().build();

  private final StageResult detection;
  private final StageResult diagnosis;
  private final StageResult prediction;
  private final ConsensusDecision consensus;
  private final StageResult resolution;
  private final StageResult communication;
  private final IncidentStatus status;
  private final Instant resolvedAt;
  private final Map<String, Object> contextDelta;
  private final List<TimelineEvent> timelineEvents;
  private final Map<String, Object> values;

  private StateUpdate(Builder b) {
    this.detection = b.detection;
    this.diagnosis = b.diagnosis;
    this.prediction = b.prediction;
    this.consensus = b.consensus;
    this.resolution = b.resolution;
    this.communication = b.communication;
    this.status = b.status;
    this.resolvedAt = b.resolvedAt;
    this.contextDelta = Collections.unmodifiableMap(new LinkedHashMap<>(b.contextDelta));
    this.timelineEvents = List.copyOf(b.timelineEvents);
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(b.values));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static StateUpdate empty() {
    return EMPTY;
  }

  /** Right-hand slots win; context and values are shallow-merged; timelines are concatenated. */
  public static StateUpdate merge(StateUpdate left, StateUpdate right) {
    Builder b = builder();
    b.copyFrom(left);
    b.copyFrom(right);
    return b.build();
  }

  public StageResult detection() {
    return detection;
  }

  public StageResult diagnosis() {
    return diagnosis;
  }

  public StageResult prediction() {
    return prediction;
  }

  public ConsensusDecision consensus() {
    return consensus;
  }

  public StageResult resolution() {
    return resolution;
  }

  public StageResult communication() {
    return communication;
  }

  public IncidentStatus status() {
    return status;
  }

  public Instant resolvedAt() {
    return resolvedAt;
  }

  public Map<String, Object> contextDelta() {
    return contextDelta;
  }

  public List<TimelineEvent> timelineEvents() {
    return timelineEvents;
  }

  public Map<String, Object> values() {
    return values;
  }

  public static final class Builder {
    private StageResult detection;
    private StageResult diagnosis;
    private StageResult prediction;
    private ConsensusDecision consensus;
    private StageResult resolution;
    private StageResult communication;
    private IncidentStatus status;
    private Instant resolvedAt;
    private final Map<String, Object> contextDelta = new LinkedHashMap<>();
    private final List<TimelineEvent> timelineEvents = new ArrayList<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder detection(StageResult result) {
      this.detection = result;
      return this;
    }

    public Builder diagnosis(StageResult result) {
      this.diagnosis = result;
      return this;
    }

    public Builder prediction(StageResult result) {
      this.prediction = result;
      return this;
    }

    public Builder consensus(ConsensusDecision decision) {
      this.consensus = decision;
      return this;
    }

    public Builder resolution(StageResult result) {
      this.resolution = result;
      return this;
    }

    public Builder communication(StageResult result) {
      this.communication = result;
      return this;
    }

    public Builder status(IncidentStatus status) {
      this.status = status;
      return this;
    }

    public Builder resolvedAt(Instant resolvedAt) {
      this.resolvedAt = resolvedAt;
      return this;
    }

    public Builder context(String key, Object value) {
      contextDelta.put(key, value);
      return this;
    }

    public Builder context(Map<String, Object> delta) {
      contextDelta.putAll(delta);
      return this;
    }

    public Builder timeline(TimelineEvent event) {
      timelineEvents.add(event);
      return this;
    }

    /**
     * Free-form value; shallow overwrite.
     *
     * @throws IllegalArgumentException for the reserved {@code context} / {@code timeline} keys
     */
    public Builder value(String key, Object value) {
      if (StateKeys.isReserved(key)) {
        throw new IllegalArgumentException("reserved state key: " + key);
      }
      values.put(key, value);
      return this;
    }

    private void copyFrom(StateUpdate u) {
      if (u == null) {
        return;
      }
      if (u.detection != null) {
        detection = u.detection;
      }
      if (u.diagnosis != null) {
        diagnosis = u.diagnosis;
      }
      if (u.prediction != null) {
        prediction = u.prediction;
      }
      if (u.consensus != null) {
        consensus = u.consensus;
      }
      if (u.resolution != null) {
        resolution = u.resolution;
      }
      if (u.communication != null) {
        communication = u.communication;
      }
      if (u.status != null) {
        status = u.status;
      }
      if (u.resolvedAt != null) {
        resolvedAt = u.resolvedAt;
      }
      contextDelta.putAll(u.contextDelta);
      timelineEvents.addAll(u.timelineEvents);
      values.putAll(u.values);
    }

    public StateUpdate build() {
      return new StateUpdate(this);
    }
  }
}
