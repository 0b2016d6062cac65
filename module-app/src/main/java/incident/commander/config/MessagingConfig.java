package incident.commander.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.messaging.EnvelopeCodec;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.infrastructure.messaging.MessageBusProperties;
import incident.commander.infrastructure.messaging.ResilientMessageBus;
import incident.commander.infrastructure.messaging.memory.InMemoryDurableTransport;
import incident.commander.infrastructure.messaging.memory.InMemoryLowLatencyTransport;
import incident.commander.infrastructure.messaging.redis.RedisLowLatencyTransport;
import incident.commander.infrastructure.messaging.sqs.SqsDurableTransport;
import incident.commander.infrastructure.messaging.transport.DurableTransport;
import incident.commander.infrastructure.messaging.transport.LowLatencyTransport;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.time.Clock;
import java.util.Collections;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * Message bus wiring.
 *
 * <p>{@code incident.message-bus.transport} picks the transports: {@code redis-sqs} uses Redisson
 * and SQS, {@code in-memory} (the default) keeps everything in process. The bus itself is shut
 * down by {@link incident.commander.lifecycle.MessageBusLifecycle}; its two pools are container
 * beans and are stopped by Spring after it.
 *
 * <ul>
 *   <li><b>messageBusReceiveExecutor</b>: one long-running receive loop per subscribed agent, no
 *       queue, so a subscription beyond {@code receive-threads} is rejected
 *   <li><b>messageBusRetryScheduler</b>: delayed redelivery of failed handler calls
 * </ul>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MessageBusProperties.class)
public class MessagingConfig {

  static final String TRANSPORT_PROPERTY = "incident.message-bus.transport";

  @Bean
  public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
    return new EnvelopeCodec(objectMapper);
  }

  @Bean(name = "messageBusReceiveExecutor")
  public ThreadPoolTaskExecutor messageBusReceiveExecutor(
      MessageBusProperties properties, MeterRegistry meterRegistry) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getReceiveThreads());
    executor.setMaxPoolSize(properties.getReceiveThreads());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("bus-receive-");
    // loops never finish on their own; interrupt them on close
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "bus.receive", Collections.emptyList())
        .bindTo(meterRegistry);
    return executor;
  }

  @Bean(name = "messageBusRetryScheduler")
  public ThreadPoolTaskScheduler messageBusRetryScheduler(
      MessageBusProperties properties, MeterRegistry meterRegistry) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.getRetryThreads());
    scheduler.setThreadNamePrefix("bus-retry-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds((int) properties.getShutdownTimeout().toSeconds());
    scheduler.initialize();
    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "bus.retry", Collections.emptyList())
        .bindTo(meterRegistry);
    return scheduler;
  }

  @Bean(destroyMethod = "")
  public MessageBus messageBus(
      LowLatencyTransport lowLatencyTransport,
      DurableTransport durableTransport,
      CircuitBreakerRegistry circuitBreakerRegistry,
      EnvelopeCodec envelopeCodec,
      LogicExecutor logicExecutor,
      MessageBusProperties properties,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry,
      @Qualifier("messageBusRetryScheduler") ThreadPoolTaskScheduler messageBusRetryScheduler,
      @Qualifier("messageBusReceiveExecutor") ThreadPoolTaskExecutor messageBusReceiveExecutor,
      Clock clock) {
    log.info(
        "[MessagingConfig] message bus created: transport={}, queuePrefix={}",
        properties.getTransport(),
        properties.getQueuePrefix());
    return new ResilientMessageBus(
        lowLatencyTransport,
        durableTransport,
        circuitBreakerRegistry,
        envelopeCodec,
        logicExecutor,
        properties,
        retryRegistry,
        meterRegistry,
        messageBusRetryScheduler,
        messageBusReceiveExecutor,
        clock);
  }

  @Configuration
  @ConditionalOnProperty(name = TRANSPORT_PROPERTY, havingValue = "redis-sqs")
  static class RemoteTransports {

    @Bean(destroyMethod = "")
    public LowLatencyTransport lowLatencyTransport(RedissonClient redissonClient) {
      return new RedisLowLatencyTransport(redissonClient);
    }

    @Bean(destroyMethod = "")
    public DurableTransport durableTransport(SqsClient sqsClient, ObjectMapper objectMapper) {
      return new SqsDurableTransport(sqsClient, objectMapper);
    }
  }

  @Configuration
  @ConditionalOnProperty(name = TRANSPORT_PROPERTY, havingValue = "in-memory", matchIfMissing = true)
  static class InMemoryTransports {

    @Bean(destroyMethod = "")
    public LowLatencyTransport lowLatencyTransport(Clock clock) {
      return new InMemoryLowLatencyTransport(clock);
    }

    @Bean(destroyMethod = "")
    public DurableTransport durableTransport() {
      return new InMemoryDurableTransport();
    }
  }
}
