package incident.commander.lifecycle;

import incident.commander.core.domain.model.agent.AgentType;
import incident.commander.infrastructure.messaging.MessageBus;
import incident.commander.notification.CommunicationInbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Subscribes the in-process consumers on start and shuts the message bus down on stop.
 *
 * <p>The phase sits below the web server's, so the server stops accepting requests before the bus
 * goes away, and the bus is closed before the clients it uses are destroyed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageBusLifecycle implements SmartLifecycle {

  private final MessageBus messageBus;
  private final CommunicationInbox communicationInbox;
  private volatile boolean running;

  @Override
  public void start() {
    messageBus.subscribe(AgentType.COMMUNICATION.value(), communicationInbox);
    running = true;
    log.info("[MessageBusLifecycle] message bus ready: healthy={}", messageBus.stats().healthy());
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    log.info("[MessageBusLifecycle] shutting down message bus");
    messageBus.shutdown();
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public int getPhase() {
    return SmartLifecycle.DEFAULT_PHASE - 4096;
  }
}
