package incident.commander.config;

import incident.commander.infrastructure.messaging.MessageBusProperties;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

/** SQS client for the durable transport. An endpoint override points it at LocalStack. */
@Slf4j
@Configuration
@ConditionalOnProperty(name = MessagingConfig.TRANSPORT_PROPERTY, havingValue = "redis-sqs")
public class SqsConfig {

  @Bean(destroyMethod = "")
  public SqsClient sqsClient(MessageBusProperties properties) {
    MessageBusProperties.Sqs sqs = properties.getSqs();
    SqsClientBuilder builder =
        SqsClient.builder()
            .region(Region.of(sqs.getRegion()))
            .credentialsProvider(DefaultCredentialsProvider.create());
    if (sqs.getEndpoint() != null && !sqs.getEndpoint().isBlank()) {
      builder.endpointOverride(URI.create(sqs.getEndpoint()));
      log.info("[SqsConfig] endpoint override: {}", sqs.getEndpoint());
    }
    return builder.build();
  }
}
