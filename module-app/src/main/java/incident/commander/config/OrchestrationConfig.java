package incident.commander.config;

import incident.commander.agent.IncidentAgents;
import incident.commander.core.consensus.ConsensusEngine;
import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.core.port.out.NotificationPort;
import incident.commander.infrastructure.executor.LogicExecutor;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.infrastructure.resilience.CircuitBreakerRegistry;
import incident.commander.orchestration.IncidentResponseGraph;
import incident.commander.orchestration.StateGraph;
import incident.commander.orchestration.stage.AnalysisStage;
import incident.commander.orchestration.stage.CommunicationStage;
import incident.commander.orchestration.stage.ConsensusStage;
import incident.commander.orchestration.stage.DetectionStage;
import incident.commander.orchestration.stage.DiagnosisStage;
import incident.commander.orchestration.stage.PredictionStage;
import incident.commander.orchestration.stage.ResolutionStage;
import incident.commander.orchestration.stage.StageSupport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Builds the stages and the standard incident-response graph. */
@Configuration
public class OrchestrationConfig {

  @Bean
  public StageSupport stageSupport(
      LogicExecutor logicExecutor,
      CircuitBreakerRegistry circuitBreakerRegistry,
      @Qualifier("agentTaskExecutor") ThreadPoolTaskExecutor agentTaskExecutor,
      OrchestrationProperties properties,
      Clock clock) {
    return new StageSupport(
        logicExecutor,
        circuitBreakerRegistry,
        agentTaskExecutor.getThreadPoolExecutor(),
        properties.getStageTimeout(),
        clock);
  }

  @Bean
  public IncidentResponseGraph incidentResponseGraph(
      IncidentAgents agents,
      StageSupport support,
      ConsensusEngine consensusEngine,
      NotificationPort notificationPort,
      MessageBus messageBus,
      LogicExecutor logicExecutor,
      @Qualifier("graphTaskExecutor") ThreadPoolTaskExecutor graphTaskExecutor,
      @Qualifier("stageTaskExecutor") ThreadPoolTaskExecutor stageTaskExecutor,
      OrchestrationProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    DetectionStage detection =
        new DetectionStage(agents.get(AgentType.DETECTION), support, messageBus);
    AnalysisStage analysis =
        new AnalysisStage(
            new DiagnosisStage(agents.get(AgentType.DIAGNOSIS), support),
            new PredictionStage(agents.get(AgentType.PREDICTION), support),
            logicExecutor,
            stageTaskExecutor,
            clock);
    ConsensusStage consensus = new ConsensusStage(consensusEngine, clock);
    ResolutionStage resolution = new ResolutionStage(agents.get(AgentType.RESOLUTION), support);
    CommunicationStage communication =
        new CommunicationStage(
            agents.get(AgentType.COMMUNICATION),
            support,
            notificationPort,
            messageBus,
            properties.isPublishSummary());

    StateGraph graph =
        new StateGraph(IncidentResponseGraph.NAME, logicExecutor, graphTaskExecutor, clock);
    return new IncidentResponseGraph(
        graph, detection, analysis, consensus, resolution, communication, meterRegistry);
  }
}
