package incident.commander.config;

import incident.commander.core.domain.model.agent.AgentType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Consensus settings. Unlisted agent types keep their default weight.
 *
 * <pre>
 * incident:
 *   consensus:
 *     weights:
 *       diagnosis: 0.4
 *     fragmentation-share: 0.5
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "incident.consensus")
public class ConsensusProperties {

  private Map<AgentType, Double> weights = new EnumMap<>(AgentType.class);

  /** Winner's share of the total score below which support counts as fragmented. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double fragmentationShare = 0.5;
}
