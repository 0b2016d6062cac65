package incident.commander.controller.dto;

import incident.commander.core.domain.model.incident.BusinessImpact;
import incident.commander.core.domain.model.incident.Incident;
import incident.commander.core.domain.model.incident.IncidentSeverity;
import incident.commander.core.domain.model.incident.ServiceTier;
import incident.commander.error.exception.InvalidIncidentException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Incident to run through the response pipeline.
 *
 * @param title short title
 * @param description free-form description, searched by diagnosis
 * @param severity low, medium, high or critical
 * @param context initial pipeline context, e.g. {@code telemetry_sources}, {@code alert_count}
 * @param businessImpact optional business impact
 */
public record IncidentRunRequest(
    @NotBlank String title,
    String description,
    @NotBlank String severity,
    Map<String, Object> context,
    @Valid BusinessImpactRequest businessImpact) {

  public record BusinessImpactRequest(
      @NotBlank String serviceTier,
      @PositiveOrZero long affectedUsers,
      @PositiveOrZero BigDecimal revenueImpactPerMinute) {}

  public Incident toIncident() {
    Incident incident = Incident.create(title, description, parseSeverity());
    if (businessImpact == null) {
      return incident;
    }
    return incident.withBusinessImpact(
        new BusinessImpact(
            parseTier(businessImpact.serviceTier()),
            businessImpact.affectedUsers(),
            businessImpact.revenueImpactPerMinute()));
  }

  public Map<String, Object> initialContext() {
    return context == null ? Map.of() : context;
  }

  private IncidentSeverity parseSeverity() {
    try {
      return IncidentSeverity.fromValue(severity);
    } catch (IllegalArgumentException e) {
      throw new InvalidIncidentException("severity: " + severity);
    }
  }

  private static ServiceTier parseTier(String tier) {
    try {
      return ServiceTier.valueOf(tier.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidIncidentException("serviceTier: " + tier);
    }
  }
}
