package incident.commander.core.domain.model.incident;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Incident under response.
 *
 * <p>Only the status and the resolution time ever change, and each change returns a new instance.
 *
 * @param id unique incident id
 * @param title short title
 * @param description free-form description
 * @param severity ordered severity
 * @param status lifecycle status
 * @param detectedAt detection time
 * @param resolvedAt resolution time, {@code null} until resolved
 * @param businessImpact optional business impact
 * @param tags free-form string tags
 */
public record Incident(
    String id,
    String title,
    String description,
    IncidentSeverity severity,
    IncidentStatus status,
    Instant detectedAt,
    Instant resolvedAt,
    BusinessImpact businessImpact,
    Map<String, String> tags) {

  public Incident {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id cannot be null or blank");
    }
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title cannot be null or blank");
    }
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(detectedAt, "detectedAt");
    description = description == null ? "" : description;
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  public static Incident create(String title, String description, IncidentSeverity severity) {
    return new Incident(
        UUID.randomUUID().toString(),
        title,
        description,
        severity,
        IncidentStatus.DETECTED,
        Instant.now(),
        null,
        null,
        Map.of());
  }

  public Incident withStatus(IncidentStatus newStatus) {
    return new Incident(
        id, title, description, severity, newStatus, detectedAt, resolvedAt, businessImpact, tags);
  }

  public Incident withBusinessImpact(BusinessImpact impact) {
    return new Incident(
        id, title, description, severity, status, detectedAt, resolvedAt, impact, tags);
  }

  public Incident withTag(String key, String value) {
    Map<String, String> merged = new LinkedHashMap<>(tags);
    merged.put(key, value);
    return new Incident(
        id, title, description, severity, status, detectedAt, resolvedAt, businessImpact, merged);
  }

  public Incident resolve(Instant at) {
    return new Incident(
        id,
        title,
        description,
        severity,
        IncidentStatus.RESOLVED,
        detectedAt,
        Objects.requireNonNull(at, "at"),
        businessImpact,
        tags);
  }

  public Optional<BusinessImpact> impact() {
    return Optional.ofNullable(businessImpact);
  }
}
