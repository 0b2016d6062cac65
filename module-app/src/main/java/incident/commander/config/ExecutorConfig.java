package incident.commander.config;

import incident.commander.infrastructure.executor.DefaultLogicExecutor;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.executor.policy.ExecutionPipeline;
import incident.commander.infrastructure.executor.policy.ExecutionPolicy;
import incident.commander.infrastructure.executor.policy.LoggingPolicy;
import incident.commander.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * LogicExecutor wiring and the orchestration thread pools.
 *
 * <ul>
 *   <li><b>graphTaskExecutor</b>: whole pipeline runs ({@code runAsync})
 *   <li><b>stageTaskExecutor</b>: analysis fan-out branches
 *   <li><b>agentTaskExecutor</b>: individual agent calls, so the breaker can time them out
 * </ul>
 *
 * <p>Each level waits on the next, so the pools are kept separate.
 */
@Configuration
@EnableConfigurationProperties({ExecutorLoggingProperties.class, OrchestrationProperties.class})
public class ExecutorConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  public LoggingPolicy loggingPolicy(ExecutorLoggingProperties props) {
    return new LoggingPolicy(props.getSlowMs());
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionPipeline.class)
  public ExecutionPipeline executionPipeline(List<ExecutionPolicy> policies) {
    List<ExecutionPolicy> ordered = new ArrayList<>(policies);
    AnnotationAwareOrderComparator.sort(ordered);
    return new ExecutionPipeline(ordered);
  }

  @Bean
  @Primary
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(ExecutionPipeline pipeline, ExceptionTranslator translator) {
    return new DefaultLogicExecutor(pipeline, translator);
  }

  @Bean
  public TaskDecorator mdcTaskDecorator() {
    return new MdcTaskDecorator();
  }

  @Bean(name = "graphTaskExecutor")
  public ThreadPoolTaskExecutor graphTaskExecutor(
      OrchestrationProperties properties, TaskDecorator mdcTaskDecorator, MeterRegistry registry) {
    return pool("graph-", properties.getExecutorThreads(), mdcTaskDecorator, registry);
  }

  @Bean(name = "stageTaskExecutor")
  public ThreadPoolTaskExecutor stageTaskExecutor(
      OrchestrationProperties properties, TaskDecorator mdcTaskDecorator, MeterRegistry registry) {
    return pool("stage-", properties.getExecutorThreads(), mdcTaskDecorator, registry);
  }

  @Bean(name = "agentTaskExecutor")
  public ThreadPoolTaskExecutor agentTaskExecutor(
      OrchestrationProperties properties, TaskDecorator mdcTaskDecorator, MeterRegistry registry) {
    return pool("agent-", properties.getExecutorThreads() * 2, mdcTaskDecorator, registry);
  }

  private static ThreadPoolTaskExecutor pool(
      String prefix, int threads, TaskDecorator decorator, MeterRegistry registry) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix(prefix);
    executor.setTaskDecorator(decorator);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    ExecutorServiceMetrics.monitor(
        registry, executor.getThreadPoolExecutor(), prefix.substring(0, prefix.length() - 1));
    return executor;
  }
}
