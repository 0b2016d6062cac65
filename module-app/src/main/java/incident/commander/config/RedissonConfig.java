package incident.commander.config;

import java.util.Arrays;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Redisson client for the low-latency transport. Sentinel mode when master and nodes are set. */
@Configuration
@ConditionalOnProperty(name = MessagingConfig.TRANSPORT_PROPERTY, havingValue = "redis-sqs")
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Value("${spring.data.redis.sentinel.master:}")
  private String masterName;

  @Value("${spring.data.redis.sentinel.nodes:}")
  private String sentinelNodes;

  @Value("${spring.data.redis.host:localhost}")
  private String host;

  @Value("${spring.data.redis.port:6379}")
  private int port;

  @Bean(destroyMethod = "")
  public RedissonClient redissonClient() {
    Config config = new Config();
    if (isSentinelMode()) {
      configureSentinel(config);
    } else {
      configureSingleServer(config);
    }
    return Redisson.create(config);
  }

  private boolean isSentinelMode() {
    return !masterName.isEmpty() && !sentinelNodes.isEmpty();
  }

  private void configureSentinel(Config config) {
    String[] addresses =
        Arrays.stream(sentinelNodes.split(","))
            .map(node -> REDISSON_HOST_PREFIX + node.trim())
            .toArray(String[]::new);

    config
        .useSentinelServers()
        .setMasterName(masterName)
        .addSentinelAddress(addresses)
        .setCheckSentinelsList(false)
        .setReadMode(ReadMode.MASTER)
        .setRetryAttempts(3)
        .setRetryInterval(1500)
        .setTimeout(3000)
        .setConnectTimeout(5000);
  }

  private void configureSingleServer(Config config) {
    config
        .useSingleServer()
        .setAddress(REDISSON_HOST_PREFIX + host + ":" + port)
        .setRetryAttempts(3)
        .setRetryInterval(1500)
        .setTimeout(3000)
        .setConnectTimeout(5000)
        .setConnectionPoolSize(32)
        .setConnectionMinimumIdleSize(8);
  }
}
