package incident.commander.core.domain.model.incident;

import java.math.BigDecimal;

/**
 * Service tier of the affected system.
 *
 * <p>Each tier carries an estimated cost per affected user per minute, used when the revenue
 * impact is unknown.
 */
public enum ServiceTier {
  TIER_1(new BigDecimal("0.50")),
  TIER_2(new BigDecimal("0.10")),
  TIER_3(new BigDecimal("0.02"));

  private final BigDecimal costPerUserMinute;

  ServiceTier(BigDecimal costPerUserMinute) {
    this.costPerUserMinute = costPerUserMinute;
  }

  public BigDecimal costPerUserMinute() {
    return costPerUserMinute;
  }
}
