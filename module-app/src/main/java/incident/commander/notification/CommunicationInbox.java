package incident.commander.notification;

import incident.commander.infrastructure.messaging.MessageEnvelope;
import incident.commander.infrastructure.messaging.MessageHandler;
import incident.commander.orchestration.stage.CommunicationStage;
import incident.commander.orchestration.stage.DetectionStage;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Consumes the communication agent's queue: detection announcements and rendered summaries. */
@Slf4j
@Component
public class CommunicationInbox implements MessageHandler {

  private final AtomicLong received = new AtomicLong();

  @Override
  public void handle(MessageEnvelope envelope) {
    received.incrementAndGet();
    switch (envelope.messageType()) {
      case DetectionStage.DETECTED_MESSAGE_TYPE -> log.info(
          "[CommunicationInbox] incident detected: incidentId={}, severity={}",
          envelope.payload().get("incident_id"),
          envelope.payload().get("severity"));
      case CommunicationStage.SUMMARY_MESSAGE_TYPE -> log.info(
          "[CommunicationInbox] summary published: incidentId={}, channels={}",
          envelope.payload().get("incident_id"),
          envelope.payload().get(CommunicationStage.CHANNELS));
      default -> log.debug(
          "[CommunicationInbox] ignored message: type={}, messageId={}",
          envelope.messageType(),
          envelope.messageId());
    }
  }

  public long receivedCount() {
    return received.get();
  }
}
