package incident.commander.core.domain.model.incident;

import java.math.BigDecimal;

/**
 * Business impact of an incident.
 *
 * @param serviceTier tier of the affected service
 * @param affectedUsers number of affected users (non-negative)
 * @param revenueImpactPerMinute known revenue loss per minute, or {@code null} when unknown
 */
public record BusinessImpact(
    ServiceTier serviceTier, long affectedUsers, BigDecimal revenueImpactPerMinute) {

  public BusinessImpact {
    if (serviceTier == null) {
      throw new IllegalArgumentException("serviceTier cannot be null");
    }
    if (affectedUsers < 0) {
      throw new IllegalArgumentException("affectedUsers cannot be negative");
    }
    if (revenueImpactPerMinute != null && revenueImpactPerMinute.signum() < 0) {
      throw new IllegalArgumentException("revenueImpactPerMinute cannot be negative");
    }
  }

  public static BusinessImpact of(ServiceTier serviceTier, long affectedUsers) {
    return new BusinessImpact(serviceTier, affectedUsers, null);
  }

  /** Known revenue impact, or a per-user estimate from the service tier. */
  public BigDecimal costPerMinute() {
    if (revenueImpactPerMinute != null) {
      return revenueImpactPerMinute;
    }
    return serviceTier.costPerUserMinute().multiply(BigDecimal.valueOf(affectedUsers));
  }
}
