package incident.commander.config;

import incident.commander.core.consensus.ConsensusEngine;
import incident.commander.core.consensus.FragmentationPredicate;
import incident.commander.core.consensus.WeightedConsensusEngine;
import incident.commander.core.domain.model.consensus.AgentWeights;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(ConsensusProperties.class)
public class ConsensusConfig {

  @Bean
  public ConsensusEngine consensusEngine(ConsensusProperties properties, Clock clock) {
    AgentWeights weights = AgentWeights.of(properties.getWeights());
    log.info(
        "[ConsensusConfig] weighted consensus: weights={}, fragmentationShare={}",
        weights,
        properties.getFragmentationShare());
    return new WeightedConsensusEngine(
        weights, FragmentationPredicate.winnerShareBelow(properties.getFragmentationShare()), clock);
  }
}
